package com.tradingagents.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradingagents.analysis.data.DataProviderClient;
import com.tradingagents.common.decision.DecisionSynthesizer;
import com.tradingagents.common.sizing.PortfolioSnapshot;
import com.tradingagents.orchestrator.risk.IndicatorSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OrchestratorConfig {

    @Value("${workflow.selected-analysts:market,social,news,fundamentals}")
    private String selectedAnalysts;

    @Value("${workflow.max-debate-rounds:1}")
    private int maxDebateRounds;

    @Value("${workflow.max-risk-discuss-rounds:1}")
    private int maxRiskDiscussRounds;

    @Value("${workflow.position.portfolio-size:100000}")
    private double portfolioSize;

    @Value("${workflow.portfolio.sector-weight:0.0}")
    private double sectorWeight;

    @Value("${workflow.portfolio.drawdown:0.0}")
    private double drawdown;

    @Value("${workflow.portfolio.open-positions:0}")
    private int openPositions;

    @Value("${workflow.portfolio.sector-count:0}")
    private int sectorCount;

    @Bean
    public WorkflowSettings workflowSettings() {
        return new WorkflowSettings(WorkflowSettings.parseAnalysts(selectedAnalysts),
            maxDebateRounds, maxRiskDiscussRounds);
    }

    @Bean
    public PortfolioSnapshot portfolioSnapshot() {
        return new PortfolioSnapshot(sectorWeight, drawdown, openPositions, sectorCount);
    }

    @Bean
    public DecisionSynthesizer decisionSynthesizer(PortfolioSnapshot portfolioSnapshot) {
        return new DecisionSynthesizer(portfolioSize, portfolioSnapshot);
    }

    @Bean
    public IndicatorSource indicatorSource(DataProviderClient dataProviderClient) {
        return dataProviderClient::indicators;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
