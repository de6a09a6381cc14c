package com.openrangelabs.copilot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.copilot.connector.auth.ConnectorCredentials;
import com.openrangelabs.copilot.connector.crm.CrmConnector;
import com.openrangelabs.copilot.connector.marketing.MarketingConnector;
import com.openrangelabs.copilot.http.HttpGateway;
import com.openrangelabs.copilot.model.PaginationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the connectors once at startup from externalized configuration.
 *
 * <p>Credentials are read here and nowhere else. Missing credentials abort the
 * application context instead of surfacing on the first call.
 */
@Configuration
public class ConnectorConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ConnectorConfiguration.class);

    @Bean
    public PaginationSettings paginationSettings(
            @Value("${copilot.pagination.page-size:100}") int pageSize,
            @Value("${copilot.pagination.max-records:10000}") int maxRecords) {
        PaginationSettings settings = new PaginationSettings(pageSize, maxRecords);
        logger.info("Bulk fetches use {} (at most {} requests each)", settings, settings.maxPages());
        return settings;
    }

    @Bean
    public CrmConnector crmConnector(
            HttpGateway gateway,
            ObjectMapper objectMapper,
            PaginationSettings paginationSettings,
            @Value("${copilot.crm.base-url:}") String baseUrl,
            @Value("${copilot.crm.username:}") String username,
            @Value("${copilot.crm.access-key:}") String accessKey,
            @Value("${copilot.crm.score-field:" + CrmConnector.DEFAULT_SCORE_FIELD + "}") String scoreField) {

        ConnectorCredentials credentials = ConnectorCredentials.basic(baseUrl, username, accessKey);
        logger.info("Configured CRM connector: {}", credentials);
        return new CrmConnector(gateway, objectMapper, credentials, paginationSettings, scoreField);
    }

    @Bean
    public MarketingConnector marketingConnector(
            HttpGateway gateway,
            ObjectMapper objectMapper,
            PaginationSettings paginationSettings,
            @Value("${copilot.marketing.base-url:}") String baseUrl,
            @Value("${copilot.marketing.access-token:}") String accessToken,
            @Value("${copilot.marketing.username:}") String username,
            @Value("${copilot.marketing.password:}") String password,
            @Value("${copilot.marketing.client-id:}") String clientId,
            @Value("${copilot.marketing.client-secret:}") String clientSecret) {

        ConnectorCredentials credentials = ConnectorCredentials.resolve(
                baseUrl, accessToken, username, password, clientId, clientSecret);
        logger.info("Configured marketing connector: {}", credentials);
        return new MarketingConnector(gateway, objectMapper, credentials, paginationSettings);
    }
}
