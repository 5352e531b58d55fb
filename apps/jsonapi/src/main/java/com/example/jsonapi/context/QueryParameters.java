package com.example.jsonapi.context;

import com.example.jsonapi.common.JsonApiConstants;
import com.example.jsonapi.exception.BadRequestException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.MultiValueMap;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalized JSON:API query parameter groups. Absent groups are empty, never null.
 *
 * @param fields  sparse fieldsets by resource type ({@code fields[posts]=title,body})
 * @param include relationship paths to include
 * @param filter  filter values by key ({@code filter[author]=9})
 * @param page    pagination values by key ({@code page[size]=10})
 * @param sort    sort fields, a leading {@code -} meaning descending
 */
public record QueryParameters(
        Map<String, Set<String>> fields,
        List<String> include,
        Map<String, String> filter,
        Map<String, String> page,
        List<String> sort
) {
    private static final Pattern GROUP_MEMBER = Pattern.compile("^([a-z]+)\\[([^\\]]*)]$");

    public static final QueryParameters EMPTY =
            new QueryParameters(Map.of(), List.of(), Map.of(), Map.of(), List.of());

    public QueryParameters {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(fields);
        include = include == null ? List.of() : List.copyOf(include);
        filter = filter == null ? Map.of() : Collections.unmodifiableMap(filter);
        page = page == null ? Map.of() : Collections.unmodifiableMap(page);
        sort = sort == null ? List.of() : List.copyOf(sort);
    }

    @NonNull
    public static QueryParameters parse(@NonNull MultiValueMap<String, String> raw) {
        Map<String, Set<String>> fields = new LinkedHashMap<>();
        Map<String, String> filter = new LinkedHashMap<>();
        Map<String, String> page = new LinkedHashMap<>();
        List<String> include = List.of();
        List<String> sort = List.of();

        for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
            String key = entry.getKey();
            String value = last(entry.getValue());
            if (JsonApiConstants.INCLUDE.equals(key)) {
                include = splitList(value);
                continue;
            }
            if (JsonApiConstants.SORT.equals(key)) {
                sort = splitList(value);
                continue;
            }
            Matcher matcher = GROUP_MEMBER.matcher(key);
            if (!matcher.matches()) {
                continue;
            }
            String group = matcher.group(1);
            String member = matcher.group(2);
            if (member.isEmpty() && JsonApiConstants.QUERY_GROUPS.contains(group)) {
                throw new BadRequestException("Query parameter '" + key + "' is missing a member name");
            }
            switch (group) {
                case JsonApiConstants.FIELDS -> fields.put(member, new LinkedHashSet<>(splitList(value)));
                case JsonApiConstants.FILTER -> filter.put(member, value == null ? "" : value);
                case JsonApiConstants.PAGE -> page.put(member, value == null ? "" : value);
                default -> {
                    // not a JSON:API group, left to handlers through the raw request
                }
            }
        }
        return new QueryParameters(fields, include, filter, page, sort);
    }

    public boolean hasFilter(String key) {
        return filter.containsKey(key);
    }

    /**
     * Sparse fieldset for a type, {@code null} when the client did not restrict it.
     */
    @Nullable
    public Set<String> fieldsFor(String type) {
        return fields.get(type);
    }

    private static String last(List<String> values) {
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    private static List<String> splitList(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
