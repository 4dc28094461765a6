package com.github.salilvnair.proofgen.engine.hash;

import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

@Component
public class Sha256ContentHasher implements ContentHasher {

    @Override
    public String hash(byte[] content) {
        return DigestUtils.sha256Hex(content == null ? new byte[0] : content);
    }

    @Override
    public String algorithm() {
        return "SHA-256";
    }
}
