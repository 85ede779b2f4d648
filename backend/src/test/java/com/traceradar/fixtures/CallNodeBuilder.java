package com.traceradar.fixtures;

import com.traceradar.common.TokenAmounts;
import com.traceradar.domain.FunctionCategory;
import com.traceradar.domain.FunctionParameters;
import com.traceradar.domain.ProcessedCallNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Test builder for ProcessedCallNode with neutral defaults: an untracked top-level CALL, 21,000 gas, no value.
 */
public final class CallNodeBuilder {

    public static final String SENDER = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    public static final String OTHER = "0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";

    private int index;
    private List<Integer> traceAddress = List.of();
    private String callType = "CALL";
    private String from = SENDER;
    private String to = OTHER;
    private BigInteger valueWei = BigInteger.ZERO;
    private long gasUsed = 21_000L;
    private boolean tracked;
    private String contractName = "Other Contract";
    private String functionName = "Contract Interaction / ETH Transfer";
    private FunctionCategory category = FunctionCategory.OTHER;
    private FunctionParameters parameters = FunctionParameters.empty();
    private String selector;
    private String error;

    private CallNodeBuilder() {
    }

    public static CallNodeBuilder call() {
        return new CallNodeBuilder();
    }

    /** Tracked PYUSD token call. */
    public static CallNodeBuilder tracked(String functionName) {
        return call().to(TraceJson.PYUSD).tracked(true).contractName("PYUSD Token").functionName(functionName);
    }

    public CallNodeBuilder index(int index) {
        this.index = index;
        return this;
    }

    public CallNodeBuilder at(Integer... path) {
        this.traceAddress = new ArrayList<>(Arrays.asList(path));
        return this;
    }

    public CallNodeBuilder callType(String callType) {
        this.callType = callType;
        return this;
    }

    public CallNodeBuilder from(String from) {
        this.from = from;
        return this;
    }

    public CallNodeBuilder to(String to) {
        this.to = to;
        return this;
    }

    public CallNodeBuilder valueWei(BigInteger valueWei) {
        this.valueWei = valueWei;
        return this;
    }

    public CallNodeBuilder valueEther(long ether) {
        this.valueWei = TokenAmounts.unit(TokenAmounts.NATIVE_DECIMALS).multiply(BigInteger.valueOf(ether));
        return this;
    }

    public CallNodeBuilder gas(long gasUsed) {
        this.gasUsed = gasUsed;
        return this;
    }

    public CallNodeBuilder tracked(boolean tracked) {
        this.tracked = tracked;
        return this;
    }

    public CallNodeBuilder contractName(String contractName) {
        this.contractName = contractName;
        return this;
    }

    public CallNodeBuilder functionName(String functionName) {
        this.functionName = functionName;
        return this;
    }

    public CallNodeBuilder category(FunctionCategory category) {
        this.category = category;
        return this;
    }

    public CallNodeBuilder parameters(FunctionParameters parameters) {
        this.parameters = parameters;
        return this;
    }

    public CallNodeBuilder amount(BigInteger amount) {
        this.parameters = new FunctionParameters(OTHER, null, amount, OTHER, null, null, null);
        return this;
    }

    public CallNodeBuilder selector(String selector) {
        this.selector = selector;
        return this;
    }

    public CallNodeBuilder error(String error) {
        this.error = error;
        return this;
    }

    public ProcessedCallNode build() {
        return new ProcessedCallNode(
                index,
                traceAddress,
                callType,
                traceAddress.size(),
                from,
                to,
                valueWei,
                TokenAmounts.scale(valueWei, TokenAmounts.NATIVE_DECIMALS),
                gasUsed,
                tracked,
                contractName,
                functionName,
                category,
                parameters,
                selector,
                "",
                "",
                error);
    }
}
