package com.boxoffice.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Elasticsearch cluster connection configuration for the warehouse load.
 */
@Data
@NoArgsConstructor
public class ElasticsearchConfig {

    private boolean enabled = true;
    private List<String> hosts;
    private String username;
    private String password;
    private int connectTimeoutMs = 5000;
    private int socketTimeoutMs = 30000;

    /** Documents per bulk request. */
    private int bulkSize = 1000;

    private String revenuesAlias = "stg_revenues_raw";
    private String moviesAlias = "stg_movies_enriched";
}
