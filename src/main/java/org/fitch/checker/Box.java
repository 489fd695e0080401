package org.fitch.checker;

/**
 * Sottoprova aperta da un'assunzione, identificata dagli indici della prima e
 * dell'ultima riga nella sequenza della dimostrazione.
 */
public final class Box {

    private final Box parent;
    private final int depth;
    private final int firstIndex;
    private int lastIndex;
    private boolean closed;

    Box(Box parent, int depth, int firstIndex) {
        this.parent = parent;
        this.depth = depth;
        this.firstIndex = firstIndex;
        this.lastIndex = firstIndex;
    }

    /** Sottoprova che racchiude questa, null se aperta al livello principale. */
    public Box getParent() {
        return parent;
    }

    public int getDepth() {
        return depth;
    }

    public int getFirstIndex() {
        return firstIndex;
    }

    public int getLastIndex() {
        return lastIndex;
    }

    public boolean isClosed() {
        return closed;
    }

    void extendTo(int index) {
        if (closed) {
            throw new IllegalStateException("Sottoprova " + this + " già chiusa");
        }
        lastIndex = index;
    }

    void close() {
        closed = true;
    }

    /**
     * Verifica se questa sottoprova è la stessa di other o è contenuta in essa.
     */
    boolean isWithin(Box other) {
        for (Box box = this; box != null; box = box.parent) {
            if (box == other) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Box[" + firstIndex + ".." + lastIndex + ", depth=" + depth + (closed ? ", closed" : "") + "]";
    }
}
