package com.foodgram.backend.domain.dto.common;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import org.springframework.data.domain.Page;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.function.Function;

@Getter
@Builder
@AllArgsConstructor
@Schema(description = "Paginated list: total count, neighbour page links and the page content")
public class PageResponse<T> {

    private long count;
    private String next;
    private String previous;
    private List<T> results;

    /**
     * @param currentRequest builder over the current request URI; {@code page} is rewritten on it
     */
    public static <E, T> PageResponse<T> of(Page<E> page, Function<E, T> mapper, UriComponentsBuilder currentRequest) {
        List<T> results = page.getContent().stream().map(mapper).toList();
        return of(page, results, currentRequest);
    }

    public static <T> PageResponse<T> of(Page<?> page, List<T> results, UriComponentsBuilder currentRequest) {
        int current = page.getNumber() + 1;
        String next = page.hasNext() ? pageLink(currentRequest, current + 1) : null;
        String previous = page.hasPrevious() ? pageLink(currentRequest, current - 1) : null;
        return new PageResponse<>(page.getTotalElements(), next, previous, results);
    }

    private static String pageLink(UriComponentsBuilder builder, int page) {
        UriComponentsBuilder copy = builder.cloneBuilder();
        if (page <= 1) {
            copy.replaceQueryParam("page");
        } else {
            copy.replaceQueryParam("page", page);
        }
        return copy.build().toUriString();
    }
}
