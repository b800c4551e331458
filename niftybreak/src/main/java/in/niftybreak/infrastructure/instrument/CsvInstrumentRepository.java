package in.niftybreak.infrastructure.instrument;

import in.niftybreak.domain.model.OptionContract;
import in.niftybreak.domain.model.TradeSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Instrument master loaded from a CSV file.
 *
 * Columns: symbol, token, strike, expiry, option_type, lot_size (header row
 * required, any column order). The index row is the underlying symbol with an
 * option type other than CE/PE (INDEX, EQ or blank).
 */
public final class CsvInstrumentRepository implements InstrumentLookup {
    private static final Logger log = LoggerFactory.getLogger(CsvInstrumentRepository.class);
    private static final List<String> REQUIRED = List.of("symbol", "token", "strike", "expiry", "option_type", "lot_size");

    private final String underlying;
    private final List<OptionContract> options = new ArrayList<>();
    private final TreeSet<LocalDate> expiries = new TreeSet<>();
    private String indexToken;

    private CsvInstrumentRepository(String underlying) {
        this.underlying = underlying.toUpperCase(Locale.ROOT);
    }

    /**
     * Load the instrument master.
     *
     * @throws IllegalStateException if the file is missing, unreadable or lacks required columns
     */
    public static CsvInstrumentRepository load(Path csv, String underlying) {
        if (!Files.isRegularFile(csv)) {
            throw new IllegalStateException("Instruments CSV not found at " + csv);
        }
        try {
            List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
            CsvInstrumentRepository repo = new CsvInstrumentRepository(underlying);
            repo.parse(lines);
            log.info("Loaded {} option contracts ({} expiries) from {}, index token={}",
                repo.options.size(), repo.expiries.size(), csv, repo.indexToken);
            return repo;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read instruments CSV " + csv + ": " + e.getMessage(), e);
        }
    }

    private void parse(List<String> lines) {
        if (lines.isEmpty()) {
            throw new IllegalStateException("Instruments CSV is empty");
        }
        Map<String, Integer> columns = new HashMap<>();
        String[] header = lines.get(0).split(",", -1);
        for (int i = 0; i < header.length; i++) {
            columns.put(header[i].trim().toLowerCase(Locale.ROOT), i);
        }
        List<String> missing = new ArrayList<>();
        for (String col : REQUIRED) {
            if (!columns.containsKey(col)) {
                missing.add(col);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Instruments CSV missing columns: " + missing);
        }

        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                parseLine(line.split(",", -1), columns);
            } catch (RuntimeException e) {
                log.warn("Failed to parse instruments line {}: {}", i + 1, e.getMessage());
            }
        }
    }

    private void parseLine(String[] parts, Map<String, Integer> columns) {
        String symbol = field(parts, columns, "symbol");
        String token = field(parts, columns, "token");
        String optionType = field(parts, columns, "option_type").toUpperCase(Locale.ROOT);

        if (!optionType.equals("CE") && !optionType.equals("PE")) {
            String upper = symbol.toUpperCase(Locale.ROOT);
            if (indexToken == null && upper.contains(underlying)
                && !upper.endsWith("CE") && !upper.endsWith("PE")) {
                indexToken = token;
            }
            return;
        }

        String strikeStr = field(parts, columns, "strike");
        String expiryStr = field(parts, columns, "expiry");
        String lotStr = field(parts, columns, "lot_size");

        BigDecimal strike = new BigDecimal(strikeStr);
        LocalDate expiry = LocalDate.parse(expiryStr.length() > 10 ? expiryStr.substring(0, 10) : expiryStr);
        int lotSize = lotStr.isEmpty() ? 0 : (int) Double.parseDouble(lotStr);

        options.add(new OptionContract(symbol, token, strike, TradeSide.fromOptionType(optionType), expiry, lotSize));
        expiries.add(expiry);
    }

    private static String field(String[] parts, Map<String, Integer> columns, String name) {
        int idx = columns.get(name);
        return idx < parts.length ? parts[idx].trim() : "";
    }

    @Override
    public Optional<OptionContract> find(BigDecimal strike, TradeSide side, LocalDate expiry) {
        for (OptionContract c : options) {
            if (c.side() == side && c.expiry().equals(expiry) && c.strike().compareTo(strike) == 0) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<LocalDate> nearestExpiry(LocalDate onOrAfter) {
        return Optional.ofNullable(expiries.ceiling(onOrAfter));
    }

    @Override
    public Optional<String> indexToken() {
        return Optional.ofNullable(indexToken);
    }

    /**
     * Placeholder for a market-depth check: a contract is considered liquid
     * when it has a token and a positive lot size.
     */
    @Override
    public boolean isLiquid(OptionContract contract) {
        return !contract.token().isEmpty() && contract.lotSize() > 0;
    }

    public int size() {
        return options.size();
    }
}
