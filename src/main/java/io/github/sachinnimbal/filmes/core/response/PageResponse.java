package io.github.sachinnimbal.filmes.core.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing. {@code page} is 1-based.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {
    private List<T> items;
    private int page;
    private int pageSize;
    private long total;
    private int totalPages;
    private boolean first;
    private boolean last;

    public static <T> PageResponse<T> from(Page<T> springPage) {
        return from(springPage, Function.identity());
    }

    public static <E, T> PageResponse<T> from(Page<E> springPage, Function<? super E, ? extends T> mapper) {
        List<T> items = springPage.getContent().stream()
                .<T>map(mapper)
                .toList();

        return PageResponse.<T>builder()
                .items(items)
                .page(springPage.getNumber() + 1)
                .pageSize(springPage.getSize())
                .total(springPage.getTotalElements())
                .totalPages(springPage.getTotalPages())
                .first(springPage.isFirst())
                .last(springPage.isLast())
                .build();
    }
}
