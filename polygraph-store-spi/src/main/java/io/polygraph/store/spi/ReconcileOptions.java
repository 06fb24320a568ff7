package io.polygraph.store.spi;

/**
 * @param relinkOrphans attach children no morph references to their source's active morph
 * @param pruneDangling delete children whose nodes are gone and drop morph references to missing children
 */
public record ReconcileOptions(boolean relinkOrphans, boolean pruneDangling) {

    public static ReconcileOptions repair() {
        return new ReconcileOptions(true, false);
    }

    public static ReconcileOptions reportOnly() {
        return new ReconcileOptions(false, false);
    }

    public static ReconcileOptions repairAndPrune() {
        return new ReconcileOptions(true, true);
    }
}
