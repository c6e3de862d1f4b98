package com.github.salilvnair.commandconsole.intent;

import com.github.salilvnair.commandconsole.security.Actor;

public record NormalizationRequest(String message, Actor actor) {
}
