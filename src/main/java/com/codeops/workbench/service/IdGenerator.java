package com.codeops.workbench.service;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Source of fresh entity ids.
 */
@Component
public class IdGenerator {

    public String newId() {
        return UUID.randomUUID().toString();
    }
}
