package com.traceradar.ingestion.normalizer;

import com.traceradar.common.HexValues;
import com.traceradar.domain.FunctionCategory;
import com.traceradar.domain.FunctionParameters;
import com.traceradar.domain.KnownFunctions;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the function identity of a call. Tracked contracts get the full decode table; any other contract
 * only gets a generic name carrying the raw selector.
 */
@Component
public class FunctionDecoder {

    static final Set<String> CALL_KINDS = Set.of("CALL", "DELEGATECALL", "STATICCALL", "CALLCODE");
    static final Set<String> CREATE_KINDS = Set.of("CREATE", "CREATE2");
    static final Set<String> DESTRUCT_KINDS = Set.of("SUICIDE", "SELFDESTRUCT");

    static final String PLAIN_INTERACTION = "Contract Interaction / ETH Transfer";
    static final String UNKNOWN_INTERACTION = "Unknown Interaction";

    public DecodedFunction decode(String callType, String input, boolean tracked) {
        if (CREATE_KINDS.contains(callType)) {
            return DecodedFunction.of(KnownFunctions.CONSTRUCTOR, FunctionCategory.CONSTRUCTOR);
        }
        if (DESTRUCT_KINDS.contains(callType)) {
            return DecodedFunction.of(KnownFunctions.SELFDESTRUCT, FunctionCategory.DESTRUCT);
        }
        if (!CALL_KINDS.contains(callType)) {
            return DecodedFunction.of(KnownFunctions.NOT_DECODED, FunctionCategory.OTHER);
        }
        String digits = HexValues.stripPrefix(input);
        if (digits == null || digits.isEmpty()) {
            return DecodedFunction.of(PLAIN_INTERACTION, FunctionCategory.OTHER);
        }
        String selector = HexValues.selector(input);
        if (selector == null) {
            return DecodedFunction.of(UNKNOWN_INTERACTION, FunctionCategory.OTHER);
        }
        if (!tracked) {
            String name = KnownSelectorDirectory.lookup(selector)
                    .map(known -> known + " (" + selector + ")")
                    .orElse("Function (" + selector + ")");
            return DecodedFunction.of(name, FunctionCategory.OTHER);
        }
        return FunctionSignatureTable.lookup(selector)
                .map(signature -> new DecodedFunction(signature.name(), signature.category(), decodeParameters(signature, input)))
                .orElseGet(() -> DecodedFunction.of("Unknown (" + selector + ")", FunctionCategory.OTHER));
    }

    /**
     * Decodes named arguments; returns empty parameters unless every word of the layout is present.
     */
    FunctionParameters decodeParameters(FunctionSignature signature, String input) {
        if (signature.params().isEmpty() || HexValues.argumentWordCount(input) < signature.params().size()) {
            return FunctionParameters.empty();
        }
        Map<String, Object> values = new HashMap<>();
        for (int i = 0; i < signature.params().size(); i++) {
            FunctionSignature.Param param = signature.params().get(i);
            String word = HexValues.argumentWord(input, i);
            Object value = switch (param.type()) {
                case ADDRESS -> HexValues.wordToAddress(word);
                case UINT256 -> HexValues.toBigInteger(word);
            };
            values.put(param.name(), value);
        }
        return new FunctionParameters(
                (String) values.get("to"),
                (String) values.get("from"),
                (BigInteger) values.get("amount"),
                (String) values.get("spender"),
                (String) values.get("owner"),
                (String) values.get("account"),
                (String) values.get("newOwner"));
    }
}
