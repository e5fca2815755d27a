package com.khaounen.authguard.security.events;

@FunctionalInterface
public interface GuardEventListener {

    GuardEventListener NO_OP = event -> { };

    void onEvent(GuardEvent event);
}
