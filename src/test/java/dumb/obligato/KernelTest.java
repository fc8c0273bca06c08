package dumb.obligato;

import dumb.obligato.Kernel.ConstantEntry;
import dumb.obligato.Kernel.Kind;
import dumb.obligato.Kernel.Scope;
import dumb.obligato.Universes.Constraint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KernelTest {

    private Kernel kernel;

    private static ConstantEntry def(String name, String type, String body) {
        return ConstantEntry.definition(name, Term.of(type), Term.of(body), false, Kind.DEFINITION, Scope.GLOBAL, Universes.EMPTY);
    }

    @BeforeEach
    void setUp() {
        kernel = new Kernel.Basic();
    }

    @Test
    void everyRegistrationMakesANewSnapshot() {
        var before = kernel.env();
        var d = kernel.declare(def("one", "nat", "(S O)"));
        assertSame(kernel.env(), d.env());
        assertTrue(d.env().version() > before.version());
        assertFalse(before.contains("one"));
        assertTrue(d.env().contains("one"));
        assertDoesNotThrow(() -> kernel.checkCurrent(d.env()));
        assertThrows(StaleEnvironmentException.class, () -> kernel.checkCurrent(before));
    }

    @Test
    void rejectsHolesAndClashes() {
        assertThrows(ProgramException.KernelError.class, () -> kernel.declare(def("h", "nat", "(S ?x)")));
        kernel.declare(def("one", "nat", "(S O)"));
        assertThrows(ProgramException.AlreadyDeclared.class, () -> kernel.declare(def("one", "nat", "O")));
    }

    @Test
    void rejectsInconsistentUniverses() {
        var bad = Universes.of(List.of("a", "b"), Constraint.lt("a", "b"), Constraint.lt("b", "a"));
        var e = ConstantEntry.definition("t", Term.of("(Type a)"), Term.of("(Type b)"), false, Kind.DEFINITION, Scope.GLOBAL, bad);
        assertThrows(ProgramException.KernelError.class, () -> kernel.declare(e));
        assertFalse(kernel.env().contains("t"));
    }

    @Test
    void mutualGroupIsAllOrNothing() {
        kernel.declare(def("b", "nat", "O"));
        var version = kernel.env().version();
        assertThrows(ProgramException.AlreadyDeclared.class,
                () -> kernel.declareMutual(List.of(def("a", "nat", "b"), def("b", "nat", "a"))));
        assertFalse(kernel.env().contains("a"));
        assertEquals(version, kernel.env().version());
    }

    @Test
    void admittedIsInherited() {
        kernel.declare(ConstantEntry.assumption("ax", Term.of("P"), Scope.GLOBAL, Universes.EMPTY));
        kernel.declare(def("uses", "P", "(id ax)"));
        kernel.declare(def("clean", "Q", "q"));
        kernel.declare(def("unsafe", "R", "r").unsafe(true));
        var env = kernel.env();
        assertTrue(env.lookup("ax").orElseThrow().admitted());
        assertTrue(env.lookup("uses").orElseThrow().admitted());
        assertFalse(env.lookup("clean").orElseThrow().admitted());
        assertTrue(env.lookup("unsafe").orElseThrow().admitted());
    }

    @Test
    void onlyTransparentConstantsUnfold() {
        kernel.declare(def("t", "nat", "O"));
        kernel.declare(ConstantEntry.definition("o", Term.of("nat"), Term.of("O"), true, Kind.DEFINITION, Scope.GLOBAL, Universes.EMPTY));
        assertEquals(Term.of("O"), kernel.env().unfold("t").orElseThrow());
        assertTrue(kernel.env().unfold("o").isEmpty());
    }

    @Test
    void sectionsDropTheirLocals() {
        kernel.openSection("S");
        kernel.addSectionVariable("A", Term.of("Type"));
        kernel.declare(ConstantEntry.definition("loc", Term.of("A"), Term.of("a"), false, Kind.DEFINITION, Scope.LOCAL, Universes.EMPTY));
        kernel.declare(def("glob", "nat", "O"));
        assertEquals("S", kernel.env().lookup("loc").orElseThrow().section());
        assertTrue(kernel.env().contains("A"));
        kernel.closeSection();
        assertFalse(kernel.env().contains("loc"));
        assertFalse(kernel.env().contains("A"));
        assertTrue(kernel.env().contains("glob"));
        assertThrows(ProgramException.KernelError.class, kernel::closeSection);
        assertThrows(ProgramException.KernelError.class, () -> kernel.addSectionVariable("x", Term.of("nat")));
    }
}
