package io.polygraph.core;

/**
 * Optional fields for relation creation.
 *
 * @param id explicit id; derived from {@code (source, name, target)} when null
 */
public record RelationOptions(String id, String adverb, String modality) {

    private static final RelationOptions NONE = new RelationOptions(null, null, null);

    public static RelationOptions none() {
        return NONE;
    }

    public static RelationOptions adverb(String adverb) {
        return new RelationOptions(null, adverb, null);
    }

    public RelationOptions withModality(String modality) {
        return new RelationOptions(id, adverb, modality);
    }

    public RelationOptions withId(String id) {
        return new RelationOptions(id, adverb, modality);
    }
}
