package com.sproutsocial.rmq;

/**
 * Outcome the output stage decided for one delivery, handed to the {@link AckDispatcher}.
 */
public final class AckIntent {

    private final long deliveryTag;
    private final AckMode outcome;

    public AckIntent(long deliveryTag, AckMode outcome) {
        this.deliveryTag = deliveryTag;
        this.outcome = outcome;
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public AckMode getOutcome() {
        return outcome;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AckIntent)) {
            return false;
        }
        AckIntent other = (AckIntent) o;
        return deliveryTag == other.deliveryTag && outcome == other.outcome;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(deliveryTag) + outcome.hashCode();
    }

    @Override
    public String toString() {
        return "AckIntent{" + deliveryTag + " " + outcome + '}';
    }

}
