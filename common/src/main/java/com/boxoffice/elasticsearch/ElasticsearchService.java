package com.boxoffice.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.CountRequest;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.DeleteIndexRequest;
import co.elastic.clients.elasticsearch.indices.ExistsAliasRequest;
import co.elastic.clients.elasticsearch.indices.GetAliasRequest;
import co.elastic.clients.elasticsearch.indices.RefreshRequest;
import co.elastic.clients.elasticsearch.indices.UpdateAliasesRequest;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.boxoffice.config.ElasticsearchConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Wraps the Elasticsearch interactions of the warehouse load.
 *
 * <p>Responsible for:
 * <ul>
 *   <li>Replacing everything behind an index alias with a new record set, all or nothing</li>
 *   <li>Counting documents behind an alias (post-load validation)</li>
 * </ul>
 *
 * <h3>Full replace</h3>
 * <p>Records are bulk-indexed into a fresh {@code <alias>-<epochMillis>} index. Only when
 * every bulk item succeeded is the alias moved to it, in a single alias update, and the
 * indices it used to point at are dropped. Any failure deletes the fresh index and leaves
 * the alias where it was.</p>
 */
@Slf4j
public class ElasticsearchService implements Closeable {

    private static final String UPDATED = "updated";

    private final ElasticsearchClient client;
    private final RestClient restClient;
    private final int bulkSize;
    private final Clock clock;

    public ElasticsearchService(ElasticsearchConfig config) {
        HttpHost[] hosts = config.getHosts().stream()
                .map(HttpHost::create)
                .toArray(HttpHost[]::new);

        RestClientBuilder builder = RestClient.builder(hosts)
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(config.getConnectTimeoutMs())
                        .setSocketTimeout(config.getSocketTimeoutMs()));

        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY,
                    new UsernamePasswordCredentials(config.getUsername(), config.getPassword()));
            builder.setHttpClientConfigCallback(hcb ->
                    hcb.setDefaultCredentialsProvider(credentialsProvider));
        }

        ObjectMapper documentMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.restClient = builder.build();
        RestClientTransport transport = new RestClientTransport(restClient, new JacksonJsonpMapper(documentMapper));
        this.client = new ElasticsearchClient(transport);
        this.bulkSize = config.getBulkSize();
        this.clock = Clock.systemUTC();
    }

    public ElasticsearchService(ElasticsearchClient client, int bulkSize, Clock clock) {
        this.client = client;
        this.restClient = null;
        this.bulkSize = bulkSize;
        this.clock = clock;
    }

    /**
     * Replaces the documents behind {@code alias} with {@code documents}.
     *
     * @param idOf document id for each record; may return {@code null} to let Elasticsearch assign one
     * @return number of distinct documents now in the new index; lower than {@code documents.size()}
     *         when records shared an id and overwrote each other
     * @throws WarehouseLoadException if any step fails; the alias is left unchanged
     */
    public <D> int replaceAlias(String alias, List<D> documents, Function<D, String> idOf) {
        String index = alias + "-" + clock.millis();
        log.info("Loading {} documents into {} (alias {})", documents.size(), index, alias);

        try {
            client.indices().create(CreateIndexRequest.of(c -> c.index(index)));
        } catch (IOException | RuntimeException e) {
            throw new WarehouseLoadException("Failed to create index " + index, e);
        }

        int indexed = 0;
        try {
            for (int from = 0; from < documents.size(); from += bulkSize) {
                List<D> batch = documents.subList(from, Math.min(from + bulkSize, documents.size()));
                indexed += indexBatch(index, batch, idOf);
            }
            client.indices().refresh(RefreshRequest.of(r -> r.index(index)));

            List<String> previous = indicesBehind(alias);
            swapAlias(alias, index, previous);
            if (!previous.isEmpty()) {
                client.indices().delete(DeleteIndexRequest.of(d -> d.index(previous)));
                log.info("Dropped previous indices {} of alias {}", previous, alias);
            }
        } catch (IOException | RuntimeException e) {
            discard(index);
            if (e instanceof WarehouseLoadException) {
                throw (WarehouseLoadException) e;
            }
            throw new WarehouseLoadException("Failed to load alias " + alias + ": " + e.getMessage(), e);
        }

        if (indexed < documents.size()) {
            log.warn("{} of {} records sent to {} overwrote a record with the same id",
                    documents.size() - indexed, documents.size(), index);
        }
        log.info("Alias {} now points at {} ({} documents)", alias, index, indexed);
        return indexed;
    }

    /**
     * Counts the documents behind an alias or index.
     */
    public long count(String alias) throws IOException {
        long count = client.count(CountRequest.of(c -> c.index(alias))).count();
        log.info("Count for {}: {}", alias, count);
        return count;
    }

    @Override
    public void close() throws IOException {
        if (restClient != null) {
            restClient.close();
        }
    }

    // ──────────────────────── internals ──────────────────────────────────

    /**
     * @return documents created by this batch; an item that replaced an existing id does not count
     */
    private <D> int indexBatch(String index, List<D> batch, Function<D, String> idOf) throws IOException {
        BulkRequest.Builder bulk = new BulkRequest.Builder();
        for (D document : batch) {
            String id = idOf.apply(document);
            bulk.operations(op -> op.index(idx -> idx.index(index).id(id).document(document)));
        }

        BulkResponse response = client.bulk(bulk.build());
        if (response.errors()) {
            List<String> reasons = new ArrayList<>();
            for (BulkResponseItem item : response.items()) {
                if (item.error() != null) {
                    reasons.add(item.id() + ": " + item.error().reason());
                }
            }
            log.error("Bulk load into {} rejected {} documents, first: {}",
                    index, reasons.size(), reasons.isEmpty() ? "n/a" : reasons.get(0));
            throw new WarehouseLoadException("Bulk load into " + index + " rejected "
                    + reasons.size() + " of " + batch.size() + " documents");
        }
        int created = 0;
        for (BulkResponseItem item : response.items()) {
            if (!UPDATED.equals(item.result())) {
                created++;
            }
        }
        log.debug("Indexed batch of {} documents into {} ({} new)", batch.size(), index, created);
        return created;
    }

    private List<String> indicesBehind(String alias) throws IOException {
        boolean exists = client.indices().existsAlias(ExistsAliasRequest.of(e -> e.name(alias))).value();
        if (!exists) {
            return List.of();
        }
        return new ArrayList<>(client.indices().getAlias(GetAliasRequest.of(g -> g.name(alias))).result().keySet());
    }

    private void swapAlias(String alias, String index, List<String> previous) throws IOException {
        UpdateAliasesRequest.Builder update = new UpdateAliasesRequest.Builder();
        for (String old : previous) {
            update.actions(a -> a.remove(r -> r.index(old).alias(alias)));
        }
        update.actions(a -> a.add(ad -> ad.index(index).alias(alias)));
        client.indices().updateAliases(update.build());
    }

    private void discard(String index) {
        try {
            client.indices().delete(DeleteIndexRequest.of(d -> d.index(index)));
            log.warn("Discarded partially loaded index {}", index);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to discard index {}: {}", index, e.getMessage());
        }
    }
}
