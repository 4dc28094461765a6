package com.github.salilvnair.proofgen.engine.guard.annotation;

import java.lang.annotation.*;

/**
 * Marks the kernel's own guards. Every other guard bean is ordered after all of them.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface BuiltInGuard {
}
