package io.pricedock.envelope;

/**
 * Either an envelope id or the reason none was created.
 */
public record EnvelopeCreateResult(String envelopeId, String reason) {
    public static EnvelopeCreateResult created(String envelopeId) {
        return new EnvelopeCreateResult(envelopeId, null);
    }

    public static EnvelopeCreateResult notCreated(String reason) {
        return new EnvelopeCreateResult(null, reason);
    }

    public boolean isCreated() {
        return envelopeId != null;
    }
}
