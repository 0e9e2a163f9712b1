package dk.trustworks.attribution.model;

/**
 * Opportunity identity as exported from the CRM. Business state over time lives in
 * {@link OpportunitySnapshot}; only the attributes used for grouping are kept here.
 *
 * @param id            internal opportunity id
 * @param externalId    CRM opportunity id
 * @param name          opportunity name
 * @param clientName    client (account) name, may be null
 * @param targetAccount target-account flag, null until set
 */
public record Opportunity(Long id, String externalId, String name, String clientName, Boolean targetAccount) {

    public static final String UNKNOWN_CUSTOMER = "Unknown";

    /**
     * Display name for customer-level views: client name when known, otherwise the
     * opportunity name, otherwise {@value #UNKNOWN_CUSTOMER}.
     */
    public String customerName() {
        if (clientName != null && !clientName.isBlank()) return clientName.trim();
        if (name != null && !name.isBlank()) return name.trim();
        return UNKNOWN_CUSTOMER;
    }
}
