package com.example.websearcher.service;

@FunctionalInterface
public interface SessionResourceFactory {

    /**
     * @throws ResourceUnavailableException if a page or agent cannot be created right now
     */
    SessionResources create();
}
