package in.tradefuse.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tradefuse.application.port.output.ExchangeClient;
import in.tradefuse.application.port.output.ExchangeException;
import in.tradefuse.application.port.output.QuoteProvider;
import in.tradefuse.domain.order.Balances;
import in.tradefuse.domain.order.Fill;
import in.tradefuse.domain.order.FillSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Coincheck spot exchange client.
 *
 * Private endpoints are signed with HMAC-SHA256 over nonce + URL + body and sent with the
 * ACCESS-KEY, ACCESS-NONCE and ACCESS-SIGNATURE headers.
 *
 * Market orders do not report their fill in the order response; the fill is aggregated from
 * /api/exchange/orders/transactions, where one order may be split across several transactions.
 *
 * Instruments are exchange pairs such as "eth_jpy"; the base asset is the part before '_'.
 */
public class CoincheckExchangeClient implements ExchangeClient, QuoteProvider {
    private static final Logger log = LoggerFactory.getLogger(CoincheckExchangeClient.class);

    public static final String DEFAULT_BASE_URL = "https://coincheck.com";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final MathContext MC = MathContext.DECIMAL64;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String accessKey;
    private final String secretKey;
    private final AtomicLong lastNonce = new AtomicLong();

    public CoincheckExchangeClient(String baseUrl, String accessKey, String secretKey) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), baseUrl, accessKey, secretKey);
    }

    CoincheckExchangeClient(HttpClient httpClient, String baseUrl, String accessKey, String secretKey) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.accessKey = accessKey;
        this.secretKey = secretKey;
    }

    @Override
    public String placeMarketBuy(String instrument, BigDecimal quoteAmount) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("pair", instrument);
        params.put("order_type", "market_buy");
        params.put("market_buy_amount", quoteAmount.toPlainString());
        return placeOrder(instrument, params);
    }

    @Override
    public String placeMarketSell(String instrument, BigDecimal quantity) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("pair", instrument);
        params.put("order_type", "market_sell");
        params.put("amount", quantity.toPlainString());
        return placeOrder(instrument, params);
    }

    private String placeOrder(String instrument, ObjectNode params) {
        log.info("[COINCHECK] Placing order: {}", params);

        // Order placement is never retried here, so every failure is non-retryable
        JsonNode result;
        try {
            result = signedRequest("POST", "/api/exchange/orders", objectMapper.writeValueAsString(params));
        } catch (ExchangeException e) {
            throw new ExchangeException("Order placement failed for " + instrument + ": " + e.getMessage(), false, e);
        } catch (IOException e) {
            throw new ExchangeException("Could not encode order for " + instrument, false, e);
        }

        if (!result.path("success").asBoolean(false)) {
            String error = result.path("error").asText("unknown error");
            log.error("[COINCHECK] Order rejected for {}: {}", instrument, error);
            throw new ExchangeException("Order rejected for " + instrument + ": " + error, false);
        }

        String orderId = result.path("id").asText(null);
        if (orderId == null || orderId.isBlank()) {
            throw new ExchangeException("Order response without id for " + instrument, false);
        }
        log.info("[COINCHECK] ✅ Order placed: {} id={}", instrument, orderId);
        return orderId;
    }

    @Override
    public Optional<Fill> getFill(String instrument, String orderId) {
        String baseAsset = baseAsset(instrument);
        String quoteAsset = quoteAsset(instrument);
        JsonNode result = signedGet("/api/exchange/orders/transactions?order_id=" + orderId + "&limit=100");

        if (!result.path("success").asBoolean(false)) {
            throw new ExchangeException("Transactions query failed: " + result.path("error").asText("unknown"), true);
        }

        BigDecimal totalBase = BigDecimal.ZERO;
        BigDecimal totalQuote = BigDecimal.ZERO;
        for (JsonNode tx : result.path("transactions")) {
            if (!orderId.equals(tx.path("order_id").asText())) {
                continue;
            }
            JsonNode funds = tx.path("funds");
            totalBase = totalBase.add(decimal(funds.path(baseAsset)).abs());
            totalQuote = totalQuote.add(decimal(funds.path(quoteAsset)).abs());
        }

        if (totalBase.signum() <= 0 || totalQuote.signum() <= 0) {
            log.debug("[COINCHECK] No fill data yet for order {}", orderId);
            return Optional.empty();
        }

        BigDecimal averagePrice = totalQuote.divide(totalBase, MC);
        log.info("[COINCHECK] Fill for {}: qty={} avg={}", orderId, totalBase, averagePrice);
        return Optional.of(new Fill(orderId, totalBase, averagePrice, FillSource.EXCHANGE));
    }

    @Override
    public Balances getBalances() {
        JsonNode result = signedGet("/api/accounts/balance");
        if (!result.path("success").asBoolean(false)) {
            throw new ExchangeException("Balance query failed: " + result.path("error").asText("unknown"), true);
        }

        Map<String, BigDecimal> free = new HashMap<>();
        Map<String, BigDecimal> reserved = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = result.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if ("success".equals(name) || !field.getValue().isValueNode()) {
                continue;
            }
            Optional<BigDecimal> value = parseDecimal(field.getValue().asText());
            if (value.isEmpty()) {
                continue;
            }
            if (name.endsWith("_reserved")) {
                reserved.put(name.substring(0, name.length() - "_reserved".length()), value.get());
            } else if (!name.contains("_")) {
                free.put(name, value.get());
            }
        }
        return new Balances(free, reserved);
    }

    @Override
    public Optional<BigDecimal> lastPrice(String instrument) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/api/ticker?pair=" + instrument))
            .header("Accept", "application/json")
            .timeout(Duration.ofSeconds(5))
            .GET()
            .build();

        JsonNode ticker = send(request);
        Optional<BigDecimal> last = parseDecimal(ticker.path("last").asText(""));
        return last.filter(p -> p.signum() > 0);
    }

    private JsonNode signedGet(String path) {
        return signedRequest("GET", path, "");
    }

    private JsonNode signedRequest(String method, String path, String body) {
        String url = baseUrl + path;
        String nonce = nextNonce();
        String signature = sign(nonce + url + body);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("ACCESS-KEY", accessKey)
            .header("ACCESS-NONCE", nonce)
            .header("ACCESS-SIGNATURE", signature)
            .header("Content-Type", "application/json")
            .timeout(REQUEST_TIMEOUT);

        if ("GET".equals(method)) {
            builder.GET();
        } else {
            builder.method(method, HttpRequest.BodyPublishers.ofString(body));
        }
        return send(builder.build());
    }

    private JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("[COINCHECK] Transport error on {}: {}", request.uri().getPath(), e.getMessage());
            throw new ExchangeException("Transport error: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException("Interrupted", false, e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            log.warn("[COINCHECK] HTTP {} on {}", status, request.uri().getPath());
            throw new ExchangeException("HTTP " + status, true);
        }
        if (status >= 400) {
            log.error("[COINCHECK] HTTP {} on {}: {}", status, request.uri().getPath(), response.body());
            throw new ExchangeException("HTTP " + status + ": " + response.body(), false);
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new ExchangeException("Malformed response from " + request.uri().getPath(), true, e);
        }
    }

    /**
     * Strictly increasing microsecond nonce.
     */
    private String nextNonce() {
        long now = System.currentTimeMillis() * 1000L;
        return Long.toString(lastNonce.updateAndGet(prev -> Math.max(prev + 1, now)));
    }

    String sign(String message) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            log.error("Failed to sign request: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to sign request", e);
        }
    }

    static String baseAsset(String instrument) {
        int idx = instrument.indexOf('_');
        return idx < 0 ? instrument : instrument.substring(0, idx);
    }

    static String quoteAsset(String instrument) {
        int idx = instrument.indexOf('_');
        return idx < 0 ? "jpy" : instrument.substring(idx + 1);
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return BigDecimal.ZERO;
        }
        return parseDecimal(node.asText()).orElse(BigDecimal.ZERO);
    }

    private static Optional<BigDecimal> parseDecimal(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric value '{}'", text);
            return Optional.empty();
        }
    }
}
