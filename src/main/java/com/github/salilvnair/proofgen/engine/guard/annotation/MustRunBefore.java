package com.github.salilvnair.proofgen.engine.guard.annotation;

import com.github.salilvnair.proofgen.engine.guard.core.Guard;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MustRunBefore {
    Class<? extends Guard>[] value();
}
