package com.dataflywheel.scoring;

public enum CandidateOutcome {
    /** Pre-customization score only; customization was not requested. */
    EVALUATED,
    /** Both pre- and post-customization scores are present. */
    CUSTOMIZED,
    /** Customization was requested but produced no post score. */
    CUSTOMIZATION_INCOMPLETE,
    /** Not even the pre-customization score could be produced. */
    NOT_EVALUABLE
}
