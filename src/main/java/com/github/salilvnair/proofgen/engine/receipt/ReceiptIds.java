package com.github.salilvnair.proofgen.engine.receipt;

import com.github.salilvnair.proofgen.engine.hash.ContentHasher;
import com.github.salilvnair.proofgen.engine.receipt.model.GenerationReceipt;
import com.github.salilvnair.proofgen.util.JsonUtil;
import lombok.experimental.UtilityClass;

@UtilityClass
public class ReceiptIds {

    /** Digest of the canonical JSON of the receipt without {@code receipt_id} and {@code signature}. */
    public static String compute(ContentHasher hasher, GenerationReceipt receipt) {
        GenerationReceipt body = receipt.withReceiptId(null).withSignature(null);
        return hasher.hash(JsonUtil.toCanonicalJson(body));
    }
}
