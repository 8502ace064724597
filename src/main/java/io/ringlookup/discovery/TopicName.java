package io.ringlookup.discovery;

/** Naming rules for partitioned topics. */
public final class TopicName {

    public static final String PARTITION_SUFFIX = "-partition-";

    private TopicName() {
    }

    public static String partition(final String topic, final int index) {
        if (index < 0) throw new IllegalArgumentException("partition index must be >= 0: " + index);
        return topic + PARTITION_SUFFIX + index;
    }
}
