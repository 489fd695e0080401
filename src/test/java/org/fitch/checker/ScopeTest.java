package org.fitch.checker;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ScopeTest {

    @Test
    public void tracksOpeningClosingAndSiblings() {
        Scope scope = new Scope();
        assertEquals(Scope.Transition.NONE, scope.advance(0, 0, false));
        assertEquals(Scope.Transition.OPENED, scope.advance(1, 1, true));
        assertEquals(Scope.Transition.NONE, scope.advance(2, 1, false));
        assertEquals(Scope.Transition.OPENED, scope.advance(3, 1, true));
        assertEquals(1, scope.getDepth());
        assertEquals(Scope.Transition.NONE, scope.advance(4, 0, false));
        assertEquals(0, scope.getDepth());

        Box first = scope.findBox(1, 2);
        Box second = scope.findBox(3, 3);
        assertNotNull(first);
        assertNotNull(second);
        assertTrue(first.isClosed());
        assertTrue(second.isClosed());
        assertNull(scope.findBox(1, 3));
    }

    @Test
    public void visibilityFollowsOpenSubproofs() {
        Scope scope = new Scope();
        scope.advance(0, 0, false);
        scope.advance(1, 1, true);
        scope.advance(2, 1, false);

        assertTrue(scope.isLineVisible(0, 2));
        assertTrue(scope.isLineVisible(1, 2));
        assertFalse(scope.isLineVisible(2, 2));

        scope.advance(3, 0, false);
        assertTrue(scope.isLineVisible(0, 3));
        assertFalse(scope.isLineVisible(1, 3));
        assertTrue(scope.isBoxVisible(scope.findBox(1, 2), 3));
    }

    @Test
    public void detectsSubproofEndingInsideNestedSubproof() {
        Scope scope = new Scope();
        scope.advance(0, 1, true);
        scope.advance(1, 2, true);
        scope.advance(2, 0, false);

        Box outer = scope.findBox(0, 1);
        Box inner = scope.findBox(1, 1);
        assertEquals(1, outer.getDepth());
        assertTrue(scope.endsInsideNestedBox(outer));
        assertFalse(scope.endsInsideNestedBox(inner));
    }

    @Test
    public void reportsDepthIncreaseWithoutAssumption() {
        Scope scope = new Scope();
        scope.advance(0, 0, false);
        assertEquals(Scope.Transition.OPENED_WITHOUT_ASSUMPTION, scope.advance(1, 1, false));
    }

    @Test
    public void reportsAssumptionAtTopLevel() {
        assertEquals(Scope.Transition.ASSUMPTION_OUTSIDE_BOX, new Scope().advance(0, 0, true));
    }

    @Test
    public void openBoxesAreListedOutermostFirst() {
        Scope scope = new Scope();
        scope.advance(0, 1, true);
        scope.advance(1, 2, true);

        List<Box> open = scope.getOpenBoxes();
        assertEquals(2, open.size());
        assertEquals(0, open.get(0).getFirstIndex());
        assertEquals(1, open.get(1).getFirstIndex());
        assertSame(open.get(0), open.get(1).getParent());
    }

    @Test
    public void linesVisibleFromNestedBox() {
        Scope scope = new Scope();
        scope.advance(0, 0, false);
        scope.advance(1, 1, true);
        scope.advance(2, 1, true);
        scope.advance(3, 2, true);
        scope.advance(4, 0, false);

        Box nested = scope.findBox(3, 3);
        assertEquals(List.of(0, 2), scope.linesVisibleFrom(nested));
    }

    @Test
    public void rejectsLinesOutOfSequence() {
        Scope scope = new Scope();
        scope.advance(0, 0, false);
        assertThrows(IllegalStateException.class, () -> scope.advance(2, 0, false));
    }
}
