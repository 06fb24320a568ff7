package io.polygraph.core;

/**
 * Optional fields for attribute and function creation.
 *
 * @param id explicit id; content-addressed from {@code (source, name, value)} when null
 */
public record AttributeOptions(String id, String adverb, String unit, String modality) {

    private static final AttributeOptions NONE = new AttributeOptions(null, null, null, null);

    public static AttributeOptions none() {
        return NONE;
    }

    public static AttributeOptions unit(String unit) {
        return new AttributeOptions(null, null, unit, null);
    }

    public AttributeOptions withAdverb(String adverb) {
        return new AttributeOptions(id, adverb, unit, modality);
    }

    public AttributeOptions withModality(String modality) {
        return new AttributeOptions(id, adverb, unit, modality);
    }

    public AttributeOptions withId(String id) {
        return new AttributeOptions(id, adverb, unit, modality);
    }
}
