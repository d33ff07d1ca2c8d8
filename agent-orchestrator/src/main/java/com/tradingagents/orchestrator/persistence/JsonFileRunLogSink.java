package com.tradingagents.orchestrator.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.common.exception.PersistenceFailureException;
import com.tradingagents.common.state.LoggableState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes {@code <dir>/<TICKER>/TradingAgentsStrategy_logs/full_states_log_<date>.json}: a JSON
 * object mapping each trade date to its loggable state.
 */
@Component
public class JsonFileRunLogSink implements RunLogSink {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRunLogSink.class);

    private final ObjectMapper objectMapper;
    private final Path baseDirectory;

    public JsonFileRunLogSink(ObjectMapper objectMapper,
                              @Value("${workflow.run-log.directory:eval_results}") String directory) {
        this.objectMapper  = objectMapper;
        this.baseDirectory = Paths.get(directory);
    }

    @Override
    public void writeRunLog(String ticker, LocalDate tradeDate, ExecutionRecord record) {
        Path file = pathFor(ticker, tradeDate);
        Map<String, LoggableState> byDate = new LinkedHashMap<>();
        record.runs().forEach((date, state) -> byDate.put(date.toString(), state));
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), byDate);
            log.info("[RunLog] Written. ticker={} date={} runs={} path={}", ticker, tradeDate, byDate.size(), file);
        } catch (IOException e) {
            throw new PersistenceFailureException("run-log", "could not write " + file + ": " + e.getMessage(), e);
        }
    }

    Path pathFor(String ticker, LocalDate tradeDate) {
        return baseDirectory.resolve(ticker)
            .resolve("TradingAgentsStrategy_logs")
            .resolve("full_states_log_" + tradeDate + ".json");
    }
}
