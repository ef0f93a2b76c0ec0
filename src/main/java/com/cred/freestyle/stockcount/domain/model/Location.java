package com.cred.freestyle.stockcount.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A store where stock counts take place.
 * Reference data, created once at startup and never changed.
 *
 * @author Stock Count Team
 */
@Value
@Builder
public class Location {

    Integer locationId;

    String name;
}
