package org.audioshelf.service.source.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CatalogHit {
    String title;
    @Singular
    List<String> authors;
    String series;
    Integer seriesIndex;
}
