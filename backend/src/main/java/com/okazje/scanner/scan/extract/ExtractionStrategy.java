package com.okazje.scanner.scan.extract;

import com.okazje.scanner.scan.model.ListingFields;
import com.okazje.scanner.scan.model.PageContext;

public interface ExtractionStrategy {
    String name();

    /**
     * Returns whatever fields this strategy can find. Missing data is expressed as empty fields,
     * never as an exception.
     */
    ListingFields extract(PageContext page);
}
