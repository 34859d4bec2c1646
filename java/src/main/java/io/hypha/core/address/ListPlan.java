package io.hypha.core.address;

/**
 * Patterns and filter used to answer a listing.
 */
public record ListPlan(ServiceIdentifier pattern, ServiceIdentifier callerScoped, String typeFilter) {
}
