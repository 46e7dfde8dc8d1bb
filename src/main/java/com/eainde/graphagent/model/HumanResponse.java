package com.eainde.graphagent.model;

/**
 * Input a human gives to a suspended session. Which fields are set depends on {@code kind}.
 *
 * @param mention ambiguous mention the choice applies to; the first pending one when null
 */
public record HumanResponse(
        HumanResponseKind kind,
        String mention,
        String candidateId,
        ToolSignature correctedSignature,
        String context
) {
    public static HumanResponse selectCandidate(String mention, String candidateId) {
        return new HumanResponse(HumanResponseKind.SELECT_CANDIDATE, mention, candidateId, null, null);
    }

    public static HumanResponse createNew(String mention) {
        return new HumanResponse(HumanResponseKind.CREATE_NEW, mention, null, null, null);
    }

    public static HumanResponse correctedSignature(ToolSignature signature) {
        return new HumanResponse(HumanResponseKind.CORRECTED_SIGNATURE, null, null, signature, null);
    }

    public static HumanResponse retry() {
        return new HumanResponse(HumanResponseKind.RETRY, null, null, null, null);
    }

    public static HumanResponse provideContext(String context) {
        return new HumanResponse(HumanResponseKind.PROVIDE_CONTEXT, null, null, null, context);
    }

    public static HumanResponse abort() {
        return new HumanResponse(HumanResponseKind.ABORT, null, null, null, null);
    }
}
