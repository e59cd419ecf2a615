package org.nowstart.stratagem.pipeline;

import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import org.nowstart.stratagem.data.exception.StateConsistencyException;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.strategy.BacktestMetrics;
import org.nowstart.stratagem.strategy.BacktestRun;
import org.nowstart.stratagem.strategy.FeatureFrame;
import org.nowstart.stratagem.strategy.PriceSeries;
import org.nowstart.stratagem.strategy.StrategySpec;
import org.nowstart.stratagem.strategy.Trade;
import org.nowstart.stratagem.strategy.ValidationResult;

/**
 * Typed outputs of the pipeline. Every setter is checked against the {@link PayloadField} owner of its slot:
 * nodes may only write their own slots while the engine runs them, and the engine only writes its own slots between nodes.
 */
@Getter
public class PipelinePayload {

    private String userText;
    private String model;
    private boolean confirmed;
    private StrategySpec spec;
    private String interpretation;
    private ValidationResult validationResult;
    private PriceSeries priceSeries;
    private FeatureFrame features;
    private ValidationResult dataValidationResult;
    private BacktestRun backtestRun;
    private BacktestMetrics metrics;
    private List<Trade> trades;
    private String explanation;

    // node currently allowed to write; null while the engine itself holds the payload
    @Getter(AccessLevel.NONE)
    private NodeName writer;
    @Getter(AccessLevel.NONE)
    private boolean sealed;

    PipelinePayload(String userText, String model) {
        this.userText = userText;
        this.model = model;
    }

    /**
     * Rebuilds the persisted slots of a checkpoint. Computed artifacts stay empty.
     */
    public static PipelinePayload restore(
            String userText,
            String model,
            boolean confirmed,
            StrategySpec spec,
            String interpretation,
            ValidationResult validationResult,
            ValidationResult dataValidationResult,
            BacktestMetrics metrics,
            List<Trade> trades,
            String explanation
    ) {
        PipelinePayload payload = new PipelinePayload(userText, model);
        payload.confirmed = confirmed;
        payload.spec = spec;
        payload.interpretation = interpretation;
        payload.validationResult = validationResult;
        payload.dataValidationResult = dataValidationResult;
        payload.metrics = metrics;
        payload.trades = trades == null ? null : List.copyOf(trades);
        payload.explanation = explanation;
        return payload;
    }

    public boolean has(PayloadField field) {
        return switch (field) {
            case USER_TEXT -> userText != null;
            case MODEL -> model != null;
            case CONFIRMED -> confirmed;
            case SPEC -> spec != null;
            case INTERPRETATION -> interpretation != null;
            case VALIDATION_RESULT -> validationResult != null;
            case PRICE_SERIES -> priceSeries != null;
            case FEATURES -> features != null;
            case DATA_VALIDATION_RESULT -> dataValidationResult != null;
            case BACKTEST_RUN -> backtestRun != null;
            case METRICS -> metrics != null;
            case TRADES -> trades != null;
            case EXPLANATION -> explanation != null;
        };
    }

    public void setSpec(StrategySpec spec) {
        checkWrite(PayloadField.SPEC);
        this.spec = spec;
    }

    public void setInterpretation(String interpretation) {
        checkWrite(PayloadField.INTERPRETATION);
        this.interpretation = interpretation;
    }

    public void setValidationResult(ValidationResult validationResult) {
        checkWrite(PayloadField.VALIDATION_RESULT);
        this.validationResult = validationResult;
    }

    public void setPriceSeries(PriceSeries priceSeries) {
        checkWrite(PayloadField.PRICE_SERIES);
        this.priceSeries = priceSeries;
    }

    public void setFeatures(FeatureFrame features) {
        checkWrite(PayloadField.FEATURES);
        this.features = features;
    }

    public void setDataValidationResult(ValidationResult dataValidationResult) {
        checkWrite(PayloadField.DATA_VALIDATION_RESULT);
        this.dataValidationResult = dataValidationResult;
    }

    public void setBacktestRun(BacktestRun backtestRun) {
        checkWrite(PayloadField.BACKTEST_RUN);
        this.backtestRun = backtestRun;
    }

    public void setMetrics(BacktestMetrics metrics) {
        checkWrite(PayloadField.METRICS);
        this.metrics = metrics;
    }

    public void setTrades(List<Trade> trades) {
        checkWrite(PayloadField.TRADES);
        this.trades = trades == null ? null : List.copyOf(trades);
    }

    public void setExplanation(String explanation) {
        checkWrite(PayloadField.EXPLANATION);
        this.explanation = explanation;
    }

    void setUserText(String userText) {
        checkWrite(PayloadField.USER_TEXT);
        this.userText = userText;
    }

    void setConfirmed(boolean confirmed) {
        checkWrite(PayloadField.CONFIRMED);
        this.confirmed = confirmed;
    }

    void enterNode(NodeName node) {
        this.writer = node;
    }

    void exitNode() {
        this.writer = null;
    }

    void seal() {
        this.sealed = true;
    }

    private void checkWrite(PayloadField field) {
        if (sealed) {
            throw new StateConsistencyException("Payload is read-only after the session finished. field=" + field);
        }
        if (field.owner() != writer) {
            throw new StateConsistencyException("Illegal payload write. field=" + field
                    + " owner=" + ownerName(field.owner()) + " writer=" + ownerName(writer));
        }
    }

    private static String ownerName(NodeName node) {
        return node == null ? "engine" : node.id();
    }
}
