package com.github.salilvnair.proofgen.annotation;

import com.github.salilvnair.proofgen.config.ProofGenAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ProofGenAutoConfiguration.class)
public @interface EnableProofGen {
}
