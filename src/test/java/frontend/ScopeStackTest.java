package frontend;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScopeStackTest {
    private static final Coord AT = new Coord("t.c", 1, 1);

    @Test
    void startsWithFileScope() {
        ScopeStack scopes = new ScopeStack();
        assertEquals(1, scopes.depth());
        assertEquals(1, scopes.getCurrentScope().getScopeLevel());
        assertNull(scopes.getCurrentScope().getParentScope());
        assertThrows(IllegalStateException.class, scopes::popScope);
    }

    @Test
    void innermostFrameDecides() {
        ScopeStack scopes = new ScopeStack();
        scopes.declare("T", NameKind.TYPEDEF, AT);
        assertTrue(scopes.isTypedef("T"));

        scopes.pushScope();
        assertTrue(scopes.isTypedef("T"));
        scopes.declare("T", NameKind.ORDINARY, AT);
        assertFalse(scopes.isTypedef("T"));
        assertEquals(2, scopes.lookup("T").scopeLevel);
        assertNull(scopes.getCurrentScope().getParentScope().lookupLocal("missing"));
        assertTrue(scopes.getCurrentScope().getParentScope().lookupLocal("T").isTypedef());

        scopes.popScope();
        assertTrue(scopes.isTypedef("T"));
        assertFalse(scopes.isTypedef("unknown"));
    }

    @Test
    void scopeNumbersAreNeverReused() {
        ScopeStack scopes = new ScopeStack();
        scopes.pushScope();
        assertEquals(2, scopes.getCurrentScope().getScopeLevel());
        scopes.popScope();
        scopes.pushScope();
        assertEquals(3, scopes.getCurrentScope().getScopeLevel());
        assertEquals(2, scopes.depth());
    }

    @Test
    void kindChangeInSameScopeConflicts() {
        ScopeStack scopes = new ScopeStack();
        scopes.declare("x", NameKind.ORDINARY, AT);
        scopes.declare("x", NameKind.ORDINARY, AT);
        DeclarationConflict conflict = assertThrows(DeclarationConflict.class,
                () -> scopes.declare("x", NameKind.TYPEDEF, new Coord("t.c", 3, 9)));
        assertEquals("x", conflict.getName());
        assertEquals("t.c:3:9: Typedef 'x' previously declared as non-typedef in this scope", conflict.getMessage());

        scopes.declare("T", NameKind.TYPEDEF, AT);
        DeclarationConflict reverse = assertThrows(DeclarationConflict.class,
                () -> scopes.declare("T", NameKind.ORDINARY, AT));
        assertTrue(reverse.getDetail().startsWith("Non-typedef 'T'"));
    }

    @Test
    void enumerationConstantsKeepTheirValue() {
        ScopeStack scopes = new ScopeStack();
        scopes.declareConstant("club", 0L, AT);
        scopes.declareConstant("later", null, AT);
        assertEquals(Long.valueOf(0), scopes.lookup("club").constantValue);
        assertNull(scopes.lookup("later").constantValue);
        assertFalse(scopes.lookup("club").isTypedef());
        assertEquals(2, scopes.getCurrentScope().getSymbols().size());
    }
}
