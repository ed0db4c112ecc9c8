package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

/** Link candidato encontrado numa página de listagem: URL absoluta e texto visível do anchor. */
public record DiscoveredLink(String url, String anchorText) {}
