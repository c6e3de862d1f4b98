package com.github.salilvnair.commandconsole.security;

public enum ScopeRule {
    /** unrestricted */
    NONE,
    /** rows tied to the actor's own identity */
    OWNER,
    /** rows inside the actor's department */
    DEPARTMENT
}
