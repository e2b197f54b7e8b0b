package com.example.battlearena.controller;

import com.example.battlearena.model.domain.User;
import org.springframework.security.core.Authentication;

import java.security.Principal;

final class PrincipalUsers {

    private PrincipalUsers() {
    }

    /** @return the logged in user behind a STOMP principal, or {@code null} */
    static User toUser(Principal principal) {
        if (principal instanceof Authentication) {
            Object user = ((Authentication) principal).getPrincipal();
            if (user instanceof User) {
                return (User) user;
            }
        }
        return null;
    }
}
