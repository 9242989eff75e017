package com.dataflywheel.runtime;

@FunctionalInterface
public interface SecretResolver {
    SecretResolver ENVIRONMENT = System::getenv;

    String resolve(String name);

    default String resolveOrNull(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return resolve(name);
    }
}
