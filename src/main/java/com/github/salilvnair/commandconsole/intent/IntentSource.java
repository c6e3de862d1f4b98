package com.github.salilvnair.commandconsole.intent;

public enum IntentSource {
    INFERENCE,
    KEYWORD
}
