package dk.lawoffice.intranet.utils;

import dk.lawoffice.intranet.dto.PagedResponse;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.panache.common.Page;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns a Panache query into a {@link PagedResponse}. Pages are 1-based on the wire; the page
 * size is clamped to the configured maximum.
 */
@ApplicationScoped
public class Pagination {

    public static final String PAGE_PARAM = "page";
    public static final String PAGE_SIZE_PARAM = "page_size";

    @ConfigProperty(name = "lawoffice.pagination.default-page-size", defaultValue = "20")
    int defaultPageSize;

    @ConfigProperty(name = "lawoffice.pagination.max-page-size", defaultValue = "100")
    int maxPageSize;

    public <E, D> PagedResponse<D> page(PanacheQuery<E> query, Integer page, Integer pageSize, UriInfo uriInfo, Function<E, D> mapper) {
        int size = effectivePageSize(pageSize);
        int number = page == null || page < 1 ? 1 : page;
        long count = query.count();
        List<D> results = query.page(Page.of(number - 1, size)).list().stream()
                .map(mapper)
                .collect(Collectors.toList());
        return build(count, number, size, uriInfo, results);
    }

    public <D> PagedResponse<D> page(List<D> rows, Integer page, Integer pageSize, UriInfo uriInfo) {
        int size = effectivePageSize(pageSize);
        int number = page == null || page < 1 ? 1 : page;
        int from = Math.min((number - 1) * size, rows.size());
        int to = Math.min(from + size, rows.size());
        return build(rows.size(), number, size, uriInfo, rows.subList(from, to));
    }

    int effectivePageSize(Integer pageSize) {
        if (pageSize == null || pageSize < 1) return defaultPageSize;
        return Math.min(pageSize, maxPageSize);
    }

    private <D> PagedResponse<D> build(long count, int number, int size, UriInfo uriInfo, List<D> results) {
        long lastPage = Math.max(1, (count + size - 1) / size);
        return PagedResponse.<D>builder()
                .count(count)
                .next(number < lastPage ? link(uriInfo, number + 1) : null)
                .previous(number > 1 ? link(uriInfo, number - 1) : null)
                .results(results)
                .build();
    }

    private String link(UriInfo uriInfo, int page) {
        if (uriInfo == null) return null;
        return uriInfo.getRequestUriBuilder().replaceQueryParam(PAGE_PARAM, page).build().toString();
    }
}
