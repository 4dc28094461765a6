package com.github.salilvnair.proofgen.engine.guard.kernel;

import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.guard.annotation.MustRunAfter;
import com.github.salilvnair.proofgen.engine.guard.core.Guard;
import com.github.salilvnair.proofgen.engine.guard.core.GuardContext;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOutcome;
import com.github.salilvnair.proofgen.engine.guard.provider.PathSafetyGuard;
import com.github.salilvnair.proofgen.engine.hash.Sha256ContentHasher;
import com.github.salilvnair.proofgen.support.ProofGenTestContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GuardRegistryTest {

    @Test
    void initOrdersBuiltInGuardsByDeclaredConstraints() {
        GuardRegistry registry = new GuardRegistry(ProofGenTestContext.builtInGuards(new Sha256ContentHasher()));

        registry.init();

        assertEquals(List.of("G1", "G2", "G3", "G4", "G5", "G6", "G7"), ids(registry));
    }

    @Test
    void customGuardBeansFollowTheBuiltInSuite() {
        List<Guard> beans = new ArrayList<>();
        beans.add(new LicenseHeaderGuard());
        beans.addAll(ProofGenTestContext.builtInGuards(new Sha256ContentHasher()));
        GuardRegistry registry = new GuardRegistry(beans);

        registry.init();

        assertEquals("A1", ids(registry).get(7));
    }

    @Test
    void registeredGuardsRunAfterBeansInRegistrationOrder() {
        GuardRegistry registry = new GuardRegistry(List.of(new PathSafetyGuard()));
        registry.init();

        registry.register(Guard.of("C2", "second", c -> GuardOutcome.pass("ok"), null));
        registry.register(Guard.of("C1", "first", c -> GuardOutcome.pass("ok"), null));

        assertEquals(List.of("G1", "C2", "C1"), ids(registry));
    }

    @Test
    void registerRejectsDuplicateId() {
        GuardRegistry registry = new GuardRegistry(List.of(new PathSafetyGuard()));
        registry.init();

        ProofGenException ex = assertThrows(ProofGenException.class,
                () -> registry.register(Guard.of("G1", "again", c -> GuardOutcome.pass("ok"), null)));

        assertEquals(ProofGenErrorCode.DUPLICATE_GUARD.name(), ex.getErrorCode());
    }

    @Test
    void initRejectsConstraintOnMissingGuard() {
        GuardRegistry registry = new GuardRegistry(List.of(new LicenseHeaderGuard()));

        ProofGenException ex = assertThrows(ProofGenException.class, registry::init);

        assertEquals(ProofGenErrorCode.MISSING_DEPENDENT_GUARD.name(), ex.getErrorCode());
    }

    @Test
    void initRejectsCycles() {
        GuardRegistry registry = new GuardRegistry(List.of(new CycleA(), new CycleB()));

        ProofGenException ex = assertThrows(ProofGenException.class, registry::init);

        assertEquals(ProofGenErrorCode.GUARD_ORDER_CYCLE.name(), ex.getErrorCode());
    }

    private List<String> ids(GuardRegistry registry) {
        return registry.guards().stream().map(Guard::id).toList();
    }

    @MustRunAfter(PathSafetyGuard.class)
    private static final class LicenseHeaderGuard extends StubGuard {
        private LicenseHeaderGuard() {
            super("A1");
        }
    }

    @MustRunAfter(CycleB.class)
    private static final class CycleA extends StubGuard {
        private CycleA() {
            super("X1");
        }
    }

    @MustRunAfter(CycleA.class)
    private static final class CycleB extends StubGuard {
        private CycleB() {
            super("X2");
        }
    }

    private abstract static class StubGuard implements Guard {
        private final String id;

        StubGuard(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String name() {
            return id;
        }

        @Override
        public GuardOutcome check(GuardContext context) {
            return GuardOutcome.pass("ok");
        }
    }
}
