package com.tradingagents.analysis.data;

import java.time.LocalDate;

public record DataRequest(DataKind kind, String ticker, LocalDate tradeDate, int lookbackDays) {

    public static DataRequest of(DataKind kind, String ticker, LocalDate tradeDate) {
        return new DataRequest(kind, ticker, tradeDate, kind.defaultLookbackDays());
    }

    /** Stable cache key: kind, ticker, date and window. */
    public String cacheKey() {
        return kind.path() + ":" + ticker + ":" + tradeDate + ":" + lookbackDays;
    }
}
