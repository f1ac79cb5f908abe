package com.flagship.property_settlement.property;

import com.flagship.property_settlement.exception.ResourceNotFoundException;

public class PropertyNotFoundException extends ResourceNotFoundException {

    public PropertyNotFoundException(String idOrSlug) {
        super("Property not found: " + idOrSlug);
    }
}
