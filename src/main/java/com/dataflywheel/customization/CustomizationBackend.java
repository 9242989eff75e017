package com.dataflywheel.customization;

import java.io.IOException;

public interface CustomizationBackend {
    /**
     * Starts a fine-tuning job and returns the backend's job id.
     */
    String submit(CustomizationRequest request) throws IOException;

    CustomizationStatus status(String externalJobId) throws IOException;
}
