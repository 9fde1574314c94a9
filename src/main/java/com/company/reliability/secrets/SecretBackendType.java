package com.company.reliability.secrets;

public enum SecretBackendType {
    ENV,
    FILE,
    VAULT,
    AWS,
    AZURE,
    GCP,
    GITHUB,
    DOPPLER;

    public static SecretBackendType fromString(String type) {
        if (type == null) {
            return ENV;
        }
        try {
            return SecretBackendType.valueOf(type.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
