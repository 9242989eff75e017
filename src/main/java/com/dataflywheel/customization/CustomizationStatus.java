package com.dataflywheel.customization;

public record CustomizationStatus(CustomizationState state, String resultModelIdentifier, String message) {
}
