package com.casekeep.analysis.stage;

public final class StageIds {

    public static final String CONVERSATION_MAP = "conversation_map";
    public static final String CLAIMS_VERIFICATION = "claims_verification";
    public static final String ISSUE_LINKING = "issue_linking";
    public static final String ISSUE_DETECTION = "issue_detection";
    public static final String AGREEMENT_CHECKS = "agreement_checks";
    public static final String PERSON_ANALYSIS = "person_analysis";
    public static final String MESSAGE_ANNOTATION = "message_annotation";
    public static final String SYNTHESIS = "synthesis";

    private StageIds() {
    }
}
