package io.github.depot2git.git;

import io.github.depot2git.UnrecognizedInputException;
import io.github.depot2git.config.UserMapping;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.PersonIdent;

/** Maps source users onto git identities, stamped in the user's timezone. */
public final class IdentityMapper {
    private static final Logger logger = LogManager.getLogger(IdentityMapper.class);
    private static final Pattern OFFSET = Pattern.compile("([+-])(\\d{2}):?(\\d{2})");

    private record Mapped(String name, String email, ZoneId zone) {}

    private final Map<String, Mapped> users = new HashMap<>();
    private final ZoneId defaultZone;
    private final Set<String> reportedUnmapped = ConcurrentHashMap.newKeySet();

    public IdentityMapper(List<UserMapping> mappings, ZoneId defaultZone) throws UnrecognizedInputException {
        this.defaultZone = defaultZone;
        for (var mapping : mappings) {
            var zone = mapping.timezone() == null ? defaultZone : parseZone(mapping.timezone());
            users.put(mapping.sourceUser(), new Mapped(mapping.name(), mapping.email(), zone));
        }
    }

    public PersonIdent identity(String sourceUser, long epochSeconds) {
        var when = Date.from(Instant.ofEpochSecond(epochSeconds));
        var mapped = users.get(sourceUser);
        if (mapped == null) {
            if (reportedUnmapped.add(sourceUser)) {
                logger.warn("No user mapping for '{}', using the source name without an email", sourceUser);
            }
            return new PersonIdent(sourceUser, "", when, TimeZone.getTimeZone(defaultZone));
        }
        return new PersonIdent(mapped.name(), mapped.email(), when, TimeZone.getTimeZone(mapped.zone()));
    }

    /** Source users without a mapping, sorted. */
    public Set<String> missingUsers(Collection<String> sourceUsers) {
        var missing = new TreeSet<String>();
        for (var user : sourceUsers) {
            if (!users.containsKey(user)) {
                missing.add(user);
            }
        }
        return missing;
    }

    /** Accepts {@code +0100}, {@code -05:30} or a zone id. */
    public static ZoneId parseZone(String value) throws UnrecognizedInputException {
        var matcher = OFFSET.matcher(value.trim());
        try {
            if (matcher.matches()) {
                int sign = matcher.group(1).equals("-") ? -1 : 1;
                return ZoneOffset.ofHoursMinutes(
                        sign * Integer.parseInt(matcher.group(2)), sign * Integer.parseInt(matcher.group(3)));
            }
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            throw new UnrecognizedInputException("Unknown timezone '" + value + "'", e);
        }
    }
}
