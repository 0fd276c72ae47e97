package com.gateway.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gateway.cli.ui.Spinner;
import com.gateway.dto.response.CommandResponse;
import com.gateway.model.AccessTier;
import com.gateway.model.ToolCatalog;
import com.gateway.model.ToolDefinition;
import com.gateway.service.api.AccessTierResolver;
import com.gateway.service.api.CatalogService;
import com.gateway.service.impl.CatalogView;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Operator commands for inspecting and rebuilding the tool catalog.
 */
@ShellComponent
public class CatalogCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_PURPLE = "\u001B[35m";

    private final CatalogService catalogService;
    private final AccessTierResolver accessTierResolver;
    private final Spinner spinner;
    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public CatalogCommand(CatalogService catalogService, AccessTierResolver accessTierResolver, Spinner spinner) {
        this.catalogService = catalogService;
        this.accessTierResolver = accessTierResolver;
        this.spinner = spinner;
    }

    /**
     * Lists the catalog, or the part of it a tier can see.
     *
     * @param tier Tier name; the whole catalog when omitted.
     */
    @ShellMethod(key = "tools", value = "List the tools of the catalog, optionally as seen by one access tier.")
    public String tools(
            @ShellOption(value = {"--tier", "-t"}, help = "Only show tools visible to this tier.", defaultValue = ShellOption.NULL) String tier
    ) {
        ToolCatalog catalog = catalogService.current();
        List<ToolDefinition> tools = catalog.tools();
        String heading = "All tools";
        if (tier != null) {
            AccessTier resolved = accessTierResolver.resolveTier(null, tier);
            tools = CatalogView.filter(catalog, resolved);
            heading = "Tools visible to tier '" + resolved.name() + "'";
        }

        StringJoiner out = new StringJoiner("\n");
        out.add(ANSI_CYAN + heading + " (" + tools.size() + ")" + ANSI_RESET);
        for (ToolDefinition tool : tools) {
            out.add(String.format("  %-60s %8d  %s", tool.getName(), tool.getSize(), tool.getService()));
        }
        return out.toString();
    }

    @ShellMethod(key = "tool-info", value = "Show how a tool is dispatched and what was noticed while extracting it.")
    public String toolInfo(@ShellOption(value = {"--name", "-n"}, help = "The tool name.") String name) {
        Optional<ToolDefinition> found = catalogService.current().find(name);
        if (found.isEmpty()) {
            return new CommandResponse(false, "Tool '" + name + "' not found in the catalog.").toAnsiString();
        }
        ToolDefinition tool = found.get();

        StringJoiner out = new StringJoiner("\n");
        out.add(ANSI_GREEN + "Tool: " + ANSI_YELLOW + tool.getName() + ANSI_RESET);
        out.add("  " + ANSI_PURPLE + tool.httpMethod() + ANSI_RESET + " " + tool.getPathTemplate());
        out.add("  Service: " + tool.getService());
        out.add("  Description: " + tool.getDescription());
        out.add("  Tiers: " + accessTierResolver.tiers().stream()
                .filter(t -> t.allows(tool.getName()))
                .map(AccessTier::name)
                .toList());
        if (!tool.getParameters().isEmpty()) {
            out.add(ANSI_CYAN + "  Parameters:" + ANSI_RESET);
            tool.getParameters().forEach(p -> out.add("    - " + p.name() + " (in: " + p.in() + ")"));
        }
        if (!tool.getDiagnostics().isEmpty()) {
            out.add(ANSI_CYAN + "  Diagnostics:" + ANSI_RESET);
            tool.getDiagnostics().forEach(d -> out.add("    [" + d.severity() + "] " + d.message()));
        }
        out.add(ANSI_CYAN + "  Input schema:" + ANSI_RESET);
        try {
            for (String line : jsonMapper.writeValueAsString(tool.getInputSchema()).split("\n")) {
                out.add("    " + line);
            }
        } catch (JsonProcessingException e) {
            out.add("    Could not format input schema.");
        }
        return out.toString();
    }

    @ShellMethod(key = "tiers", value = "Show the configured access tiers.")
    public String tiers() {
        ToolCatalog catalog = catalogService.current();
        StringJoiner out = new StringJoiner("\n");
        for (AccessTier tier : accessTierResolver.tiers()) {
            int visible = CatalogView.filter(catalog, tier).size();
            long unknown = tier.toolNames().stream()
                    .distinct()
                    .filter(name -> !catalog.contains(name))
                    .count();
            out.add(ANSI_GREEN + tier.name() + ANSI_RESET + ": " + visible + " visible tools"
                    + (unknown > 0 ? ANSI_YELLOW + " (" + unknown + " unknown names)" + ANSI_RESET : ""));
        }
        return out.toString();
    }

    @ShellMethod(key = "reload", value = "Rebuild the tool catalog from the backend descriptions.")
    public String reload() {
        try {
            ToolCatalog catalog = spinner.spin("Loading API descriptions...", catalogService::reload);
            return new CommandResponse(true, "Catalog rebuilt: " + catalog.size() + " tools from " + catalog.services()).toAnsiString();
        } catch (Exception e) {
            return new CommandResponse(false, "Failed to rebuild the catalog: " + e.getMessage()).toAnsiString();
        }
    }
}
