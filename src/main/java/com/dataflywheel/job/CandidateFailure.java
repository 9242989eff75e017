package com.dataflywheel.job;

public record CandidateFailure(String errorType, String message, CandidateStage stage) {

    public static CandidateFailure of(Throwable error, CandidateStage stage) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new CandidateFailure(error.getClass().getSimpleName(), message, stage);
    }
}
