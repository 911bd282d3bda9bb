package fr.lapetina.orchestrator.domain.model;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    PATCH
}
