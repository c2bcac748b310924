package space.ketterling.marinedata.ndbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.fetch.MalformedResponseException;

import java.util.*;

/**
 * Parser for NDBC realtime2 files: a column-name line, a units line, then one
 * whitespace-delimited data line per observation, newest first.
 */
public final class NdbcTextParser {
    private static final Logger log = LoggerFactory.getLogger(NdbcTextParser.class);

    /** NDBC token for a missing reading. */
    public static final String MISSING = "MM";

    private NdbcTextParser() {
    }

    /**
     * Parsed file. Each row maps column name to raw token; missing readings are
     * left out of the row.
     */
    public record Table(List<String> columns, List<String> units, List<Map<String, String>> rows) {
        public Optional<Map<String, String>> latest() {
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    public static Table parse(String body) throws MalformedResponseException {
        if (body == null)
            throw new MalformedResponseException("NDBC response body is empty");
        List<String> lines = new ArrayList<>();
        for (String line : body.split("\\r?\\n")) {
            if (!line.isBlank())
                lines.add(line.trim());
        }
        if (lines.size() < 3)
            throw new MalformedResponseException("NDBC file has " + lines.size() + " lines, need header, units and data");

        List<String> columns = List.of(lines.get(0).split("\\s+"));
        List<String> units = List.of(lines.get(1).split("\\s+"));
        if (!columns.get(0).startsWith("#"))
            throw new MalformedResponseException("NDBC header line does not start with '#': " + lines.get(0));

        List<Map<String, String>> rows = new ArrayList<>();
        int dropped = 0;
        for (int i = 2; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.startsWith("#"))
                continue;
            String[] tokens = line.split("\\s+");
            if (tokens.length != columns.size()) {
                dropped++;
                continue;
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < tokens.length; c++) {
                if (!MISSING.equals(tokens[c]))
                    row.put(columns.get(c), tokens[c]);
            }
            rows.add(row);
        }
        if (dropped > 0)
            log.debug("Dropped {} NDBC rows with a column count different from the header ({})", dropped,
                    columns.size());
        return new Table(columns, units, rows);
    }
}
