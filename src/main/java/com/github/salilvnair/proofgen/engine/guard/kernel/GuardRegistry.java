package com.github.salilvnair.proofgen.engine.guard.kernel;

import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.guard.annotation.BuiltInGuard;
import com.github.salilvnair.proofgen.engine.guard.annotation.MustRunAfter;
import com.github.salilvnair.proofgen.engine.guard.annotation.MustRunBefore;
import com.github.salilvnair.proofgen.engine.guard.core.Guard;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Ordered guard list. Guard beans are ordered by their {@code @MustRunAfter}/{@code @MustRunBefore}
 * constraints with every {@link BuiltInGuard} ahead of the rest; guards added through
 * {@link #register(Guard)} follow in registration order.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class GuardRegistry {

    private final List<Guard> discoveredGuards;

    private volatile List<Guard> ordered = List.of();
    private final List<Guard> registered = new CopyOnWriteArrayList<>();

    // ---------------------------------------------------------------------
    // Init
    // ---------------------------------------------------------------------
    @PostConstruct
    public void init() {
        ordered = orderByDag(discoveredGuards == null ? List.of() : discoveredGuards);
        log.info(
                "ProofGen guard order: {}",
                ordered.stream().map(Guard::id).collect(Collectors.joining(" -> "))
        );
    }

    public synchronized void register(Guard guard) {
        Objects.requireNonNull(guard, "guard");
        boolean duplicate = guards().stream().anyMatch(g -> g.id().equals(guard.id()));
        if (duplicate) {
            throw new ProofGenException(ProofGenErrorCode.DUPLICATE_GUARD, "Duplicate guard id: " + guard.id());
        }
        registered.add(guard);
    }

    public List<Guard> guards() {
        List<Guard> all = new ArrayList<>(ordered);
        all.addAll(registered);
        return all;
    }

    // ---------------------------------------------------------------------
    // DAG ordering using annotations
    // ---------------------------------------------------------------------
    private List<Guard> orderByDag(List<Guard> guards) {

        Map<Class<?>, Guard> guardByClass = new HashMap<>();
        Set<String> ids = new HashSet<>();
        for (Guard g : guards) {
            if (!ids.add(g.id())) {
                throw new ProofGenException(
                        ProofGenErrorCode.DUPLICATE_GUARD,
                        "Duplicate guard bean: " + g.getClass().getName() + " (" + g.id() + ")"
                );
            }
            guardByClass.putIfAbsent(g.getClass(), g);
        }

        Map<Guard, Set<Guard>> outgoing = new HashMap<>();
        Map<Guard, Set<Guard>> incoming = new HashMap<>();
        for (Guard g : guards) {
            outgoing.put(g, new LinkedHashSet<>());
            incoming.put(g, new LinkedHashSet<>());
        }

        for (Guard g : guards) {
            MustRunBefore before = g.getClass().getAnnotation(MustRunBefore.class);
            if (before != null) {
                for (Class<? extends Guard> b : before.value()) {
                    addEdge(outgoing, incoming, g, requirePresent(guardByClass, g, b));
                }
            }
        }

        // A must run after B => B -> A
        for (Guard g : guards) {
            MustRunAfter after = g.getClass().getAnnotation(MustRunAfter.class);
            if (after != null) {
                for (Class<? extends Guard> a : after.value()) {
                    addEdge(outgoing, incoming, requirePresent(guardByClass, g, a), g);
                }
            }
        }

        // built-in suite first
        List<Guard> builtIns = guards.stream()
                .filter(GuardRegistry::isBuiltIn)
                .toList();
        for (Guard g : guards) {
            if (!isBuiltIn(g)) {
                for (Guard builtIn : builtIns) {
                    addEdge(outgoing, incoming, builtIn, g);
                }
            }
        }

        return topoSort(guards, outgoing, incoming);
    }

    private static boolean isBuiltIn(Guard guard) {
        return guard.getClass().getAnnotation(BuiltInGuard.class) != null;
    }

    private Guard requirePresent(Map<Class<?>, Guard> guardByClass, Guard owner, Class<?> dep) {
        Guard target = guardByClass.get(dep);
        if (target == null) {
            throw new ProofGenException(
                    ProofGenErrorCode.MISSING_DEPENDENT_GUARD,
                    owner.getClass().getSimpleName() + " depends on missing guard: " + dep.getName()
            );
        }
        return target;
    }

    private void addEdge(Map<Guard, Set<Guard>> outgoing,
                         Map<Guard, Set<Guard>> incoming,
                         Guard from,
                         Guard to) {
        if (from == to) return;
        if (outgoing.get(from).add(to)) {
            incoming.get(to).add(from);
        }
    }

    private List<Guard> topoSort(List<Guard> nodes,
                                 Map<Guard, Set<Guard>> outgoing,
                                 Map<Guard, Set<Guard>> incoming) {

        Map<Guard, Integer> indegree = new HashMap<>();
        for (Guard n : nodes) {
            indegree.put(n, incoming.get(n).size());
        }

        PriorityQueue<Guard> q = new PriorityQueue<>(
                Comparator.comparing(Guard::id).thenComparing(g -> g.getClass().getName()));
        indegree.forEach((k, v) -> {
            if (v == 0) q.add(k);
        });

        List<Guard> result = new ArrayList<>();
        while (!q.isEmpty()) {
            Guard n = q.poll();
            result.add(n);
            for (Guard m : outgoing.get(n)) {
                indegree.put(m, indegree.get(m) - 1);
                if (indegree.get(m) == 0) q.add(m);
            }
        }

        if (result.size() != nodes.size()) {
            Set<Guard> remaining = new LinkedHashSet<>(nodes);
            result.forEach(remaining::remove);
            throw new ProofGenException(
                    ProofGenErrorCode.GUARD_ORDER_CYCLE,
                    "Guard ordering cycle or unsatisfied constraints: " +
                            remaining.stream()
                                    .map(Guard::id)
                                    .collect(Collectors.joining(" -> "))
            );
        }
        return result;
    }
}
