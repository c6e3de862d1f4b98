package com.github.salilvnair.commandconsole.approval;

import com.github.salilvnair.commandconsole.entity.CcPlan;
import com.github.salilvnair.commandconsole.security.Actor;

public interface SecondFactorVerifier {

    boolean verify(Actor approver, CcPlan plan, String code);
}
