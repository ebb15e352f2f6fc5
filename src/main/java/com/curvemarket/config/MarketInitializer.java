package com.curvemarket.config;

import com.curvemarket.domain.model.MarketParameters;
import com.curvemarket.engine.MarketEngine;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/** Initializes the market once at startup with the configured parameters and authority. */
@Configuration
public class MarketInitializer {

    private final MarketEngine marketEngine;
    private final MarketParameters marketParameters;
    private final String authority;

    public MarketInitializer(
            MarketEngine marketEngine,
            MarketParameters marketParameters,
            @Value("${curvemarket.authority.address}") String authority) {
        this.marketEngine = marketEngine;
        this.marketParameters = marketParameters;
        this.authority = authority;
    }

    @PostConstruct
    void initializeMarket() {
        marketEngine.initialize(marketParameters, authority);
    }
}
