package org.fitch.checker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Stack;
import java.util.logging.Logger;

/**
 * SCOPE - Stack delle sottoprove aperte durante una passata del checker
 *
 * Ricostruisce le sottoprove dalle variazioni di profondità tra righe consecutive
 * e risponde alle domande di visibilità delle citazioni.
 *
 * ORGANIZZAZIONE:
 * • Stack delle sottoprove aperte, la cima è la più interna
 * • Per ogni riga già processata, la sottoprova più interna che la contiene
 * • Elenco di tutte le sottoprove in ordine di apertura
 *
 * INVARIANTI:
 * • Dopo {@link #advance} l'altezza dello stack è la profondità della riga
 * • Una sottoprova chiusa non viene mai riaperta
 * • Un'assunzione apre sempre una nuova sottoprova, anche accanto a una sorella
 *   della stessa profondità
 *
 * Vive per una sola verifica: nessuno stato condiviso tra invocazioni.
 */
public final class Scope {

    private static final Logger LOGGER = Logger.getLogger(Scope.class.getName());

    /**
     * Effetto della riga appena registrata sulla struttura delle sottoprove.
     */
    public enum Transition {
        /** Nessuna sottoprova aperta dalla riga */
        NONE,
        /** Sottoprova aperta da un'assunzione */
        OPENED,
        /** Profondità aumentata senza assunzione: sottoprova aperta comunque */
        OPENED_WITHOUT_ASSUMPTION,
        /** Assunzione al livello principale, fuori da ogni sottoprova */
        ASSUMPTION_OUTSIDE_BOX
    }

    private final Stack<Box> openBoxes = new Stack<>();
    private final List<Box> allBoxes = new ArrayList<>();
    private final List<Box> innermostByLine = new ArrayList<>();

    //region AVANZAMENTO

    /**
     * Registra la prossima riga della dimostrazione.
     *
     * @param index posizione della riga nella sequenza (deve essere la successiva)
     * @param depth profondità della riga
     * @param assumption true se la riga è giustificata come assunzione
     * @return effetto della riga sulle sottoprove
     */
    public Transition advance(int index, int depth, boolean assumption) {
        if (index != innermostByLine.size()) {
            throw new IllegalStateException("Riga " + index + " fuori sequenza, attesa " + innermostByLine.size());
        }
        if (depth < 0) {
            throw new IllegalArgumentException("Profondità negativa: " + depth);
        }

        closeDownTo(depth);

        Transition transition = Transition.NONE;
        if (assumption && depth == 0) {
            transition = Transition.ASSUMPTION_OUTSIDE_BOX;
        } else if (assumption && openBoxes.size() == depth) {
            // Sottoprova sorella: la precedente allo stesso livello si chiude
            closeTop();
            open(index);
            transition = Transition.OPENED;
        }

        while (openBoxes.size() < depth) {
            open(index);
            transition = assumption ? Transition.OPENED : Transition.OPENED_WITHOUT_ASSUMPTION;
        }

        for (Box box : openBoxes) {
            box.extendTo(index);
        }
        innermostByLine.add(openBoxes.isEmpty() ? null : openBoxes.peek());
        return transition;
    }

    private void closeDownTo(int depth) {
        while (openBoxes.size() > depth) {
            closeTop();
        }
    }

    private void closeTop() {
        Box closed = openBoxes.pop();
        closed.close();
        LOGGER.finest("Sottoprova chiusa: " + closed);
    }

    private void open(int index) {
        Box parent = openBoxes.isEmpty() ? null : openBoxes.peek();
        Box box = new Box(parent, openBoxes.size() + 1, index);
        openBoxes.push(box);
        allBoxes.add(box);
        LOGGER.finest("Sottoprova aperta: " + box);
    }

    //endregion

    //region VISIBILITÀ

    /**
     * Una riga già processata è visibile se la sua sottoprova più interna è
     * ancora aperta (o se sta al livello principale).
     *
     * @param targetIndex riga citata
     * @param currentIndex riga che cita
     */
    public boolean isLineVisible(int targetIndex, int currentIndex) {
        if (targetIndex >= currentIndex || targetIndex >= innermostByLine.size()) {
            return false;
        }
        Box box = innermostByLine.get(targetIndex);
        return box == null || openBoxes.contains(box);
    }

    /**
     * Una sottoprova è citabile come unità se è chiusa, precede la riga corrente
     * e la sottoprova che la contiene è ancora aperta.
     */
    public boolean isBoxVisible(Box box, int currentIndex) {
        if (!box.isClosed() || box.getLastIndex() >= currentIndex) {
            return false;
        }
        return box.getParent() == null || openBoxes.contains(box.getParent());
    }

    /**
     * Cerca la sottoprova che inizia e finisce esattamente sugli indici dati.
     *
     * @return sottoprova corrispondente, oppure null se l'intervallo non è una sottoprova
     */
    public Box findBox(int firstIndex, int lastIndex) {
        for (Box box : allBoxes) {
            if (box.getFirstIndex() == firstIndex && box.getLastIndex() == lastIndex) {
                return box;
            }
        }
        return null;
    }

    /**
     * Vero se l'ultima riga della sottoprova appartiene a una sottoprova annidata:
     * la sottoprova non ha allora una conclusione al proprio livello.
     */
    public boolean endsInsideNestedBox(Box box) {
        return innermostByLine.get(box.getLastIndex()) != box;
    }

    /**
     * Sottoprove aperte, dalla più esterna alla più interna.
     */
    public List<Box> getOpenBoxes() {
        return Collections.unmodifiableList(new ArrayList<>(openBoxes));
    }

    /**
     * Indici delle righe che precedono la sottoprova e sono visibili dal suo interno:
     * righe al livello principale o in sottoprove che la racchiudono.
     */
    public List<Integer> linesVisibleFrom(Box box) {
        List<Integer> visible = new ArrayList<>();
        for (int i = 0; i < box.getFirstIndex(); i++) {
            Box container = innermostByLine.get(i);
            if (container == null || (box.getParent() != null && box.getParent().isWithin(container))) {
                visible.add(i);
            }
        }
        return visible;
    }

    public int getDepth() {
        return openBoxes.size();
    }

    //endregion
}
