package in.tradewell.infrastructure.broker.alpaca;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradewell.application.port.output.HistoryPort;
import in.tradewell.application.port.output.MarketCalendarPort;
import in.tradewell.application.port.output.PositionPort;
import in.tradewell.config.AlpacaSettings;
import in.tradewell.domain.session.Bar;
import in.tradewell.domain.session.OpenPosition;
import in.tradewell.domain.session.SessionCalendar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Alpaca Markets REST client backing the calendar, position and history ports.
 *
 * API Docs: https://alpaca.markets/docs/api-references/
 *
 * Endpoints used:
 * - GET {trading}/v2/calendar?start=&end=         trading calendar
 * - GET {trading}/v2/positions                    open positions
 * - GET {data}/v2/stocks/{symbol}/bars            1-minute bars, paged
 */
public class AlpacaRestClient implements MarketCalendarPort, PositionPort, HistoryPort {
    private static final Logger log = LoggerFactory.getLogger(AlpacaRestClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    // The calendar only lists trading days; a week ahead always covers the next session.
    private static final int CALENDAR_LOOKAHEAD_DAYS = 7;
    private static final int BARS_PAGE_LIMIT = 10000;

    private final AlpacaSettings settings;
    private final ZoneId marketZone;
    private final HttpClient httpClient;
    private final Clock clock;

    public AlpacaRestClient(AlpacaSettings settings, ZoneId marketZone) {
        this(settings, marketZone, HttpClient.newBuilder().connectTimeout(TIMEOUT).build(), Clock.systemUTC());
    }

    AlpacaRestClient(AlpacaSettings settings, ZoneId marketZone, HttpClient httpClient, Clock clock) {
        this.settings = settings;
        this.marketZone = marketZone;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    @Override
    public Optional<SessionCalendar> getSessionCalendar(LocalDate date) {
        String url = settings.tradingBaseUrl() + "/v2/calendar?start=" + date
            + "&end=" + date.plusDays(CALENDAR_LOOKAHEAD_DAYS);
        JsonNode days = get(url);

        for (JsonNode day : days) {
            LocalDate sessionDate = LocalDate.parse(day.path("date").asText());
            if (sessionDate.isBefore(date)) {
                continue;
            }
            Instant open = ZonedDateTime.of(sessionDate, LocalTime.parse(day.path("open").asText()), marketZone).toInstant();
            Instant close = ZonedDateTime.of(sessionDate, LocalTime.parse(day.path("close").asText()), marketZone).toInstant();
            log.info("[ALPACA] Next session {} open={} close={}", sessionDate, open, close);
            return Optional.of(new SessionCalendar(sessionDate, open, close));
        }

        log.warn("[ALPACA] No trading session between {} and {}", date, date.plusDays(CALENDAR_LOOKAHEAD_DAYS));
        return Optional.empty();
    }

    @Override
    public List<OpenPosition> listOpenPositions() {
        JsonNode positions = get(settings.tradingBaseUrl() + "/v2/positions");

        List<OpenPosition> result = new ArrayList<>();
        for (JsonNode position : positions) {
            result.add(new OpenPosition(
                position.path("symbol").asText(),
                new BigDecimal(position.path("qty").asText("0")),
                position.path("side").asText("long")));
        }
        log.info("[ALPACA] {} open positions", result.size());
        return result;
    }

    @Override
    public Map<String, List<Bar>> warmUp(List<String> symbols, int maxCount) {
        Instant end = clock.instant();
        Instant start = end.minus(settings.warmUpLookbackDays(), ChronoUnit.DAYS);
        log.info("[ALPACA] Warming up {} symbols (max {}) with 1-minute bars from {}", symbols.size(), maxCount, start);

        Map<String, List<Bar>> history = new LinkedHashMap<>();
        for (String symbol : new LinkedHashSet<>(symbols)) {
            if (history.size() >= maxCount) {
                log.info("[ALPACA] Reached warm-up limit of {} symbols", maxCount);
                break;
            }
            try {
                List<Bar> bars = fetchBars(symbol, start, end);
                if (bars.isEmpty()) {
                    log.warn("[ALPACA] No history for {}, dropping it", symbol);
                    continue;
                }
                history.put(symbol, bars);
            } catch (BrokerApiException e) {
                log.warn("[ALPACA] Failed to load history for {}: {}", symbol, e.getMessage());
            }
        }
        log.info("[ALPACA] Warm-up done: {} of {} symbols have history", history.size(), symbols.size());
        return history;
    }

    private List<Bar> fetchBars(String symbol, Instant start, Instant end) {
        List<Bar> bars = new ArrayList<>();
        String pageToken = null;
        do {
            StringBuilder url = new StringBuilder(settings.dataBaseUrl())
                .append("/v2/stocks/").append(encode(symbol)).append("/bars")
                .append("?timeframe=1Min")
                .append("&start=").append(encode(start.toString()))
                .append("&end=").append(encode(end.toString()))
                .append("&limit=").append(BARS_PAGE_LIMIT);
            if (pageToken != null) {
                url.append("&page_token=").append(encode(pageToken));
            }

            JsonNode page = get(url.toString());
            for (JsonNode bar : page.path("bars")) {
                bars.add(new Bar(
                    Instant.parse(bar.path("t").asText()),
                    bar.path("o").decimalValue(),
                    bar.path("h").decimalValue(),
                    bar.path("l").decimalValue(),
                    bar.path("c").decimalValue(),
                    bar.path("v").asLong()));
            }
            JsonNode next = page.path("next_page_token");
            pageToken = next.isTextual() && !next.asText().isEmpty() ? next.asText() : null;
        } while (pageToken != null);

        log.debug("[ALPACA] Fetched {} bars for {}", bars.size(), symbol);
        return bars;
    }

    private JsonNode get(String url) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(TIMEOUT)
            .header("APCA-API-KEY-ID", settings.apiKeyId())
            .header("APCA-API-SECRET-KEY", settings.apiSecret())
            .header("Accept", "application/json")
            .GET()
            .build();

        String endpoint = request.uri().getPath();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new BrokerApiException(endpoint, response.statusCode(), response.body());
            }
            return MAPPER.readTree(response.body());
        } catch (IOException e) {
            throw new BrokerApiException(endpoint, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerApiException(endpoint, "Interrupted", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
