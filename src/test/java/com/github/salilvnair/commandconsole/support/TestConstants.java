package com.github.salilvnair.commandconsole.support;

public final class TestConstants {

    private TestConstants() {
    }

    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_FACULTY = "faculty";
    public static final String ROLE_STUDENT = "student";

    public static final String ADMIN_ID = "u-admin-1";
    public static final String SECOND_ADMIN_ID = "u-admin-2";
    public static final String FACULTY_ID = "u-fac-7";
    public static final String OTHER_FACULTY_ID = "u-fac-9";
    public static final String STUDENT_ID = "u-stu-42";
    public static final String OTHER_STUDENT_ID = "u-stu-43";

    public static final String DEPT_CSE = "CSE";
    public static final String DEPT_ECE = "ECE";
    public static final String DEPT_MECH = "MECH";

    public static final String ENTITY_STUDENT = "student";
    public static final String ENTITY_USER = "user";
    public static final String ENTITY_COURSE = "course";
    public static final String ENTITY_DEPARTMENT = "department";
    public static final String ENTITY_ATTENDANCE = "attendance";

    public static final String SCENARIO_A = "Show all CSE students with CGPA below 6";
    public static final String SCENARIO_B = "Delete all inactive users";
    public static final String SCENARIO_C = "Update semester to 4 for all students in section A";
    public static final String SCENARIO_D = "Set CGPA to 9.5 for MECH students";
    public static final String SCENARIO_E = "update the grade";

    public static final String OTP_CODE = "482913";
    public static final String BOOM = "boom";
}
