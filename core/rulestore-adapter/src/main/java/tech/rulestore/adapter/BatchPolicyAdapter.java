package tech.rulestore.adapter;

import java.util.List;

/**
 * Adapter that can add or remove several rules in one call.
 */
public interface BatchPolicyAdapter extends PolicyAdapter {

    void addPolicies(String sec, String pType, List<List<String>> rules);

    void removePolicies(String sec, String pType, List<List<String>> rules);
}
