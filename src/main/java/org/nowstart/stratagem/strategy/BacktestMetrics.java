package org.nowstart.stratagem.strategy;

public record BacktestMetrics(double cagr, double maxDrawdown, double sharpe, int numTrades) {
}
