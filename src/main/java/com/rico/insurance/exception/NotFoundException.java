package com.rico.insurance.exception;

/**
 * Thrown when an operation references a carrier, policy or provider that does not exist.
 */
public class NotFoundException extends InsuranceGraphException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, Object entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = String.valueOf(entityId);
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
