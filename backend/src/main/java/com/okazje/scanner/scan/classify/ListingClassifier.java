package com.okazje.scanner.scan.classify;

import com.okazje.scanner.scan.model.Listing;

public interface ListingClassifier {
    /**
     * Returns a free-text appraisal of the listing.
     *
     * @throws ClassifierException when the model cannot be reached or is not configured
     */
    String classify(Listing listing);
}
