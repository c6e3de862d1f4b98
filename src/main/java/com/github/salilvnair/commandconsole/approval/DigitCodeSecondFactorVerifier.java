package com.github.salilvnair.commandconsole.approval;

import com.github.salilvnair.commandconsole.entity.CcPlan;
import com.github.salilvnair.commandconsole.security.Actor;

import java.util.regex.Pattern;

/**
 * Accepts any numeric code of six or more digits. Replace with a real OTP check by
 * registering another {@link SecondFactorVerifier} bean.
 */
public class DigitCodeSecondFactorVerifier implements SecondFactorVerifier {

    private static final Pattern CODE_PATTERN = Pattern.compile("^\\d{6,}$");

    @Override
    public boolean verify(Actor approver, CcPlan plan, String code) {
        return code != null && CODE_PATTERN.matcher(code.trim()).matches();
    }
}
