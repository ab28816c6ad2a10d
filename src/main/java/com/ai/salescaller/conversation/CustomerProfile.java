package com.ai.salescaller.conversation;

import org.apache.commons.lang3.StringUtils;

/**
 * What the script needs to know about the customer being called. Read once when the call is answered.
 */
public final class CustomerProfile {

    private final CustomerRef ref;
    private final String name;
    private final String carModel;
    private final String dealershipName;
    private final String emailOnFile;
    private final boolean known;

    public CustomerProfile(CustomerRef ref, String name, String carModel,
                           String dealershipName, String emailOnFile, boolean known) {
        this.ref = ref;
        this.name = name;
        this.carModel = carModel;
        this.dealershipName = dealershipName;
        this.emailOnFile = StringUtils.trimToNull(emailOnFile);
        this.known = known;
    }

    public CustomerRef getRef() {
        return ref;
    }

    public String getName() {
        return name;
    }

    public String getCarModel() {
        return carModel;
    }

    public String getDealershipName() {
        return dealershipName;
    }

    public String getEmailOnFile() {
        return emailOnFile;
    }

    /** False when nobody in the record store matched the dialled number. */
    public boolean isKnown() {
        return known;
    }
}
