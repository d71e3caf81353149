package com.celesteos.core.patterns;

import com.celesteos.core.model.EntityType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.celesteos.core.patterns.PatternFamily.COMMAND;
import static com.celesteos.core.patterns.PatternFamily.DIAGNOSTIC;
import static com.celesteos.core.patterns.PatternFamily.DIRECT_LOOKUP;
import static com.celesteos.core.patterns.PatternFamily.ELLIPTICAL;
import static com.celesteos.core.patterns.PatternFamily.IMPLICIT_ACTION;

/**
 * Process-wide rule tables: injection signatures, off-topic phrases, lane patterns,
 * entity dictionaries and the abbreviation map used for canonicalization.
 * <p>
 * Built once during class initialisation and exposed only through unmodifiable
 * collections, so concurrent readers need no synchronisation.
 */
public final class PatternTables {

    private static final String APOS = "['\u2019]";
    private static final String QUOTE = "['\u2019\"]";

    /**
     * Structural prompt/SQL/template injection markers. Matched anywhere in the
     * string, so on-domain text around a token does not hide it.
     */
    public static final List<SafePattern> INJECTION_TOKENS = List.of(
            // instruction delimiters and chat-template role tags
            SafePattern.of("inst_delimiter", "\\[/?inst\\]"),
            SafePattern.of("sys_delimiter", "<</?sys>>"),
            SafePattern.of("chat_template_token", "<\\|[a-z_]{2,20}\\|>"),
            SafePattern.of("markdown_role_header", "#{2,}\\s*(instruction|instructions|system|response|assistant)\\b"),
            SafePattern.of("xml_role_tag", "</?\\s*(system|instructions?|prompt|assistant|developer)\\s*>"),
            SafePattern.of("role_prefix", "(^|[\\n:;.!?]\\s*)(system|assistant|developer)\\s*:"),
            // instruction override phrasing
            SafePattern.of("ignore_instructions",
                    "\\b(ignore|disregard|forget)\\s+(all\\s+|any\\s+|the\\s+|your\\s+|previous\\s+|prior\\s+|above\\s+|earlier\\s+)*"
                            + "(instructions?|rules|prompts?|training|guidelines|context)\\b"),
            SafePattern.of("system_prompt", "\\b(system|base|hidden|initial)\\s+prompt\\b"),
            SafePattern.of("reveal_instructions", "\\b(reveal|show|print|repeat)\\s+(me\\s+)?(your\\s+)(base\\s+)?(prompt|instructions|rules)\\b"),
            SafePattern.of("ask_instructions", "\\bwhat\\s+(are|were)\\s+your\\s+(instructions|rules)\\b"),
            SafePattern.of("jailbreak", "\\b(jailbreak|jailbroken|dan\\s+mode|developer\\s+mode)\\b"),
            SafePattern.of("persona_override", "\\b(roleplay\\s+as|pretend\\s+(you\\s+are|to\\s+be)|act\\s+as\\s+if\\s+you|new\\s+persona)\\b"),
            SafePattern.of("safety_override", "\\b(override|bypass|disable)\\s+(the\\s+)?(safety|security|filters?|guardrails?)\\b"),
            // template expressions
            SafePattern.of("template_expression", "(\\$\\{|\\{\\{|\\}\\}|\\{%|%\\}|<%|%>)"),
            // comment terminators and CDATA
            SafePattern.of("block_comment", "(/\\*|\\*/)"),
            SafePattern.of("html_comment", "(<!--|-->)"),
            SafePattern.of("sql_line_comment", "(" + APOS + "|\")\\s*--(\\s|$)"),
            SafePattern.of("cdata_marker", "<!\\[cdata\\["),
            // quote-based boolean injection
            SafePattern.of("quoted_boolean", "(" + APOS + "|\")\\s*(or|and)\\s+(" + APOS + "|\"|\\d)"),
            SafePattern.of("tautology", "\\b(or|and)\\s+" + QUOTE + "\\w*" + QUOTE + "\\s*=\\s*" + QUOTE),
            SafePattern.of("numeric_tautology", "\\b(or|and)\\s+\\d+\\s*=\\s*\\d+\\b"),
            // SQL keywords that never appear in maintenance queries
            SafePattern.of("union_select", "\\bunion\\s+(all\\s+)?select\\b"),
            SafePattern.of("ddl_statement", "\\b(drop|truncate|alter)\\s+table\\b"),
            SafePattern.of("delete_from", "\\bdelete\\s+from\\b"),
            SafePattern.of("stacked_query", ";\\s*(select|drop|delete|insert|update|exec)\\b"),
            SafePattern.of("catalog_probe", "(\\binformation_schema\\b|\\bpg_catalog\\b|\\bpg_tables\\b|\\bsys\\.tables\\b|@@version)"),
            SafePattern.of("exec_call", "\\b(exec|eval|sp_executesql)\\s*\\("),
            // script and command injection
            SafePattern.of("script_tag", "<\\s*/?\\s*script"),
            SafePattern.of("javascript_uri", "javascript\\s*:"),
            SafePattern.of("event_handler", "\\bon(error|load|click|mouseover)\\s*="),
            SafePattern.of("shell_chain", "[;|]\\s*((ls|rm|curl|wget|sh|bash|chmod)\\b|cat\\s+/)"),
            SafePattern.of("shell_substitution", "(\\$\\(|`[^`]{0,64}`)")
    );

    /**
     * Off-topic phrasing. Openers anchored with {@code ^} only fire at the start of the
     * text they are applied to, which is why the clause guard re-applies them per clause.
     */
    public static final List<SafePattern> NON_DOMAIN = List.of(
            SafePattern.of("smalltalk_opener", "^\\s*(how\\s+are\\s+you|how" + APOS + "?s\\s+it\\s+going|what" + APOS + "?s\\s+up|who\\s+are\\s+you|good\\s+morning|good\\s+night)\\b"),
            SafePattern.of("weather", "(^\\s*(what" + APOS + "?s|what\\s+is|how" + APOS + "?s|how\\s+is)\\s+the\\s+weather\\b|\\bweather\\s+(today|tomorrow|forecast|like)\\b)"),
            SafePattern.of("clock", "\\bwhat\\s+time\\s+is\\s+it\\b"),
            SafePattern.of("finance", "\\b(bitcoin|btc|ethereum|crypto|cryptocurrency|dogecoin|stock\\s+market|stock\\s+price|share\\s+price|nasdaq|dow\\s+jones|s&p\\s+500)\\b"),
            SafePattern.of("jokes", "\\btell\\s+me\\s+(a|another)\\s+(joke|story|riddle)\\b"),
            SafePattern.of("creative_writing", "\\bwrite\\s+(me\\s+)?(a|an)\\s+(poem|song|essay|story|limerick)\\b"),
            SafePattern.of("philosophy", "\\bmeaning\\s+of\\s+life\\b"),
            SafePattern.of("politics", "\\b(who\\s+(is|" + APOS + "s|was)\\s+the\\s+president|election\\s+results?)\\b"),
            SafePattern.of("sports", "\\b(who\\s+won\\s+the|football|soccer|nba|nfl|cricket)\\s*(score|scores|game|match|results?|final)?\\b"),
            SafePattern.of("cooking", "\\b(recipes?\\s+for|how\\s+(do\\s+i|to)\\s+(cook|bake))\\b"),
            SafePattern.of("translation", "\\btranslate\\s+(this|that|hello|to|into)\\b"),
            SafePattern.of("homework", "\\b(help\\s+me\\s+with\\s+(my\\s+)?homework|explain\\s+quantum|capital\\s+of\\s+(france|spain|italy|germany))\\b"),
            SafePattern.of("coding_help", "\\bwrite\\s+(some\\s+)?code\\s+(for|to|that)\\b")
    );

    /** Coordinating conjunctions that separate independently validated clauses. */
    public static final SafePattern CLAUSE_SEPARATOR =
            SafePattern.of("clause_separator", "[\\s,;:.!?-]*\\b(and|also|then|plus|btw)\\b[\\s,;:.!?-]*");

    /** Punctuation left at either end of a clause after splitting. */
    public static final SafePattern CLAUSE_EDGE_PUNCTUATION =
            SafePattern.of("clause_edge_punctuation", "^[\\s,;:.!?-]+|[\\s,;:.!?-]+$");

    public static final SafePattern POLITE_PREFIX = SafePattern.of("polite_prefix",
            "^(please|pls|plz|kindly|hi|hey|hello|ok|okay|can\\s+you|could\\s+you|would\\s+you(\\s+mind)?|"
                    + "i\\s+need\\s+you\\s+to|i\\s+want\\s+you\\s+to)[\\s,!.]+");

    public static final SafePattern POLITE_SUFFIX = SafePattern.of("polite_suffix",
            "[\\s,]+(please|pls|plz|thanks|thank\\s+you|cheers|if\\s+you\\s+can|if\\s+possible|would\\s+you\\s+mind|for\\s+me)[\\s?!.]*$");

    public static final SafePattern TRAILING_PUNCTUATION = SafePattern.of("trailing_punctuation", "[\\s?!.]+$");

    public static final SafePattern WHITESPACE_RUN = SafePattern.of("whitespace_run", "\\s+");

    /** Verbs that mean the user wants something changed, not just looked up. */
    public static final SafePattern MUTATION_VERBS = SafePattern.of("mutation_verbs",
            "\\b(create|delete|remove|close|complete|mark|log|schedule|order|reorder|update|assign|add|raise|record|sign\\s+off)\\b");

    private static final String WORK_ORDER = "(work\\s*orders?|wos?|jobs?|tasks?)";

    /** Lane cascade, grouped by family in cascade order. Applied to the normalised query. */
    public static final List<PatternRule> LANE_RULES = List.of(
            // elliptical: verbless fragments that conventionally mean "show/open this"
            PatternRule.of(ELLIPTICAL, "elliptical_equipment_abbrev", "^(me|dg|ae|gen|ge)\\s?[1-4]$"),
            PatternRule.of(ELLIPTICAL, "elliptical_work_list",
                    "^(my|open|pending|overdue|outstanding|today" + APOS + "?s)\\s+(" + WORK_ORDER + "|faults?|defects?)$"),
            PatternRule.of(ELLIPTICAL, "elliptical_work_order_for", "^(wo|work\\s*order)\\s+(for|on)\\s+[a-z0-9/ -]{1,40}$"),
            PatternRule.of(ELLIPTICAL, "elliptical_view", "^(handover|hor|my\\s+hours|shopping\\s+list|checklist|my\\s+certificates)$"),
            PatternRule.of(ELLIPTICAL, "elliptical_stock", "^(low|out\\s+of)\\s+stock$"),

            // implicit action: statements of fact that conventionally get logged
            PatternRule.of(IMPLICIT_ACTION, "implicit_maintenance_done",
                    "^(just\\s+|i\\s+|we\\s+|have\\s+)*(replaced|changed|swapped|fitted|installed|cleaned|serviced|topped\\s+up|refilled|overhauled|repaired|fixed|greased|tested)\\b"),
            PatternRule.of(IMPLICIT_ACTION, "implicit_part_usage", "\\b(used|consumed)\\s+(\\d+|one|two|three|four|five)\\s+[a-z]"),
            PatternRule.of(IMPLICIT_ACTION, "implicit_hours", "^(i\\s+|we\\s+)?(ran|worked|rested|slept)\\s+\\d+(\\.\\d+)?\\s*(h|hr|hrs|hours)\\b"),
            PatternRule.of(IMPLICIT_ACTION, "implicit_receiving",
                    "^(the\\s+)?(parts?|delivery|shipment|order|spares|po[-\\s#]?\\d+)\\s+(has\\s+|have\\s+)?(arrived|been\\s+received|been\\s+delivered|received|delivered|came\\s+in)\\b"),

            // explicit commands: verb-anchored imperatives
            PatternRule.of(COMMAND, "command_create",
                    "^(create|open|raise|start|new)\\s+(a\\s+|an\\s+|new\\s+)*(" + WORK_ORDER + "|faults?|defects?|tickets?|requisitions?|purchase\\s+orders?)\\b"),
            PatternRule.of(COMMAND, "command_log",
                    "^(log|record|report|add)\\s+(a\\s+|an\\s+|new\\s+|the\\s+|my\\s+)*(faults?|defects?|issues?|hours|entry|note|reading|running\\s+hours|rest\\s+hours|observation)\\b"),
            PatternRule.of(COMMAND, "command_schedule",
                    "^(schedule|book|plan)\\s+.*\\b(service|maintenance|overhaul|inspection|survey|" + WORK_ORDER + ")\\b"),
            PatternRule.of(COMMAND, "command_mark", "^mark\\s+.+\\s+as\\s+(done|complete|completed|closed|resolved|fixed|received)\\b"),
            PatternRule.of(COMMAND, "command_close",
                    "^(close|complete|finish|sign\\s+off|acknowledge|resolve)\\s+(the\\s+|this\\s+|that\\s+)?(" + WORK_ORDER + "|faults?|defects?|handover|alarms?)\\b"),
            PatternRule.of(COMMAND, "command_order", "^(order|reorder|requisition)\\s+(\\d+\\s+|more\\s+|new\\s+|a\\s+|an\\s+|some\\s+|spare\\s+)"),
            PatternRule.of(COMMAND, "command_add_to",
                    "^add\\s+.+\\s+to\\s+(the\\s+|my\\s+)?(handover|shopping\\s+list|" + WORK_ORDER + "|checklist)\\b"),
            PatternRule.of(COMMAND, "command_assign", "^(assign|reassign)\\s+.+\\s+to\\s+[a-z]"),
            PatternRule.of(COMMAND, "command_attach", "^(attach|upload)\\s+(a\\s+|the\\s+)?(photo|picture|image|document|file|manual|report)\\b"),

            // direct lookups: structured identifiers or read-only "show X"
            PatternRule.of(DIRECT_LOOKUP, "lookup_work_order_number", "^(wo|work\\s*order)\\s*[-#]?\\s*\\d{2,6}$"),
            PatternRule.of(DIRECT_LOOKUP, "lookup_purchase_order_number", "^po\\s*[-#]?\\s*\\d{2,6}$"),
            PatternRule.of(DIRECT_LOOKUP, "lookup_fault_code",
                    "^(e\\d{3,4}([-_]\\d)?|spn[-_/: ]?\\d{1,5}([-_/: ]?fmi[-_/: ]?\\d{1,2})?|[pbcu][0-3]\\d{3}|(al|alm|flt|fault|alarm)[-_ ]?\\d{1,4})$"),
            PatternRule.of(DIRECT_LOOKUP, "lookup_model_number",
                    "^(cat|caterpillar|mtu|volvo|cummins|kohler|yanmar|man|northern\\s+lights|onan)?\\s*[a-z]{0,3}\\d{3,5}[a-z]{0,2}$"),
            PatternRule.of(DIRECT_LOOKUP, "lookup_part_number", "^[a-z]{1,4}-?\\d{2,6}-[a-z0-9]{1,6}$"),
            PatternRule.of(DIRECT_LOOKUP, "lookup_show_find",
                    "^(show|find|get|display|list|lookup|look\\s+up|search|search\\s+for|where\\s+is|where" + APOS + "?s|view|pull\\s+up)\\b")
                    .excluding(MUTATION_VERBS),
            PatternRule.of(DIRECT_LOOKUP, "lookup_attribute",
                    "^[a-z0-9][a-z0-9 /-]{0,60}\\s(manual|manuals|history|specs?|specifications|parts\\s+list|datasheet|drawings?|schematics?|status|location|serial\\s+number|stock)$")
                    .excluding(MUTATION_VERBS),
            PatternRule.of(DIRECT_LOOKUP, "lookup_stock_count",
                    "^how\\s+(many|much)\\b.*\\b(in\\s+stock|left|on\\s+board|do\\s+we\\s+have)\\b"),

            // diagnostic triggers
            PatternRule.of(DIAGNOSTIC, "diagnostic_intent",
                    "(^(diagnose|diag|troubleshoot|investigate|analy[sz]e)\\b|\\bwhy\\s+(is|are|does|do|did|would|won" + APOS + "?t|isn" + APOS + "?t|doesn" + APOS + "?t)\\b|"
                            + "\\bwhat" + APOS + "?s\\s+(wrong|causing)\\b|\\bwhat\\s+is\\s+(wrong|causing)\\b|\\broot\\s+cause\\b|"
                            + "\\bhow\\s+(do\\s+i|to|can\\s+i|should\\s+i)\\s+(fix|repair|troubleshoot|stop|solve)\\b)"),
            PatternRule.of(DIAGNOSTIC, "problem_vocabulary",
                    "\\b(leak|leaks|leaking|overheat|overheats|overheating|overheated|vibrating|vibration|noisy|noise|smoke|smoking|"
                            + "alarming|tripping|tripped|trips|won" + APOS + "?t\\s+start|not\\s+starting|not\\s+working|failed|failing|failure|"
                            + "broken|faulty|abnormal|erratic|fluctuating|fluctuation|low\\s+(oil\\s+)?pressure|high\\s+(temp|temperature)|"
                            + "running\\s+rough|surging|stalling|knocking|corroded|seized|stuck|cavitating|cavitation|degraded|intermittent|"
                            + "hunting|misfiring|losing\\s+(power|pressure)|burning\\s+smell)\\b"),
            PatternRule.of(DIAGNOSTIC, "temporal_context",
                    "\\b(again|keeps|keep\\s+(happening|tripping|failing)|recurring|every\\s+time|since\\s+(yesterday|last|this|the)|happening\\s+again|intermittently)\\b")
    );

    /** Equipment names and abbreviations. Longer phrases are tried first. */
    public static final List<Alias> EQUIPMENT = List.of(
            new Alias("port main engine", "MAIN_ENGINE_1", 0.95),
            new Alias("starboard main engine", "MAIN_ENGINE_2", 0.95),
            new Alias("stbd main engine", "MAIN_ENGINE_2", 0.95),
            new Alias("main engine 1", "MAIN_ENGINE_1", 0.95),
            new Alias("main engine 2", "MAIN_ENGINE_2", 0.95),
            new Alias("main engine", "MAIN_ENGINE", 0.90),
            new Alias("me1", "MAIN_ENGINE_1", 0.90),
            new Alias("me2", "MAIN_ENGINE_2", 0.90),
            new Alias("me 1", "MAIN_ENGINE_1", 0.85),
            new Alias("me 2", "MAIN_ENGINE_2", 0.85),
            new Alias("generator 1", "GENERATOR_1", 0.95),
            new Alias("generator 2", "GENERATOR_2", 0.95),
            new Alias("dg1", "GENERATOR_1", 0.90),
            new Alias("dg2", "GENERATOR_2", 0.90),
            new Alias("gen 1", "GENERATOR_1", 0.85),
            new Alias("gen 2", "GENERATOR_2", 0.85),
            new Alias("gen1", "GENERATOR_1", 0.85),
            new Alias("gen2", "GENERATOR_2", 0.85),
            new Alias("generator", "GENERATOR", 0.90),
            new Alias("genset", "GENERATOR", 0.90),
            new Alias("sea water pump", "SEA_WATER_PUMP", 0.95),
            new Alias("seawater pump", "SEA_WATER_PUMP", 0.95),
            new Alias("raw water pump", "SEA_WATER_PUMP", 0.95),
            new Alias("bilge pump", "BILGE_PUMP", 0.95),
            new Alias("bilge", "BILGE_PUMP", 0.70),
            new Alias("fuel pump", "FUEL_PUMP", 0.95),
            new Alias("fire pump", "FIRE_PUMP", 0.95),
            new Alias("watermaker", "WATERMAKER", 0.95),
            new Alias("water maker", "WATERMAKER", 0.95),
            new Alias("wm", "WATERMAKER", 0.75),
            new Alias("air conditioning", "AIR_CONDITIONING", 0.95),
            new Alias("hvac", "AIR_CONDITIONING", 0.90),
            new Alias("a/c", "AIR_CONDITIONING", 0.85),
            new Alias("ac", "AIR_CONDITIONING", 0.80),
            new Alias("bow thruster", "BOW_THRUSTER", 0.95),
            new Alias("stern thruster", "STERN_THRUSTER", 0.95),
            new Alias("stabilizers", "STABILIZER", 0.95),
            new Alias("stabilizer", "STABILIZER", 0.95),
            new Alias("stabiliser", "STABILIZER", 0.95),
            new Alias("anchor windlass", "WINDLASS", 0.95),
            new Alias("windlass", "WINDLASS", 0.95),
            new Alias("steering gear", "STEERING_GEAR", 0.95),
            new Alias("air compressor", "AIR_COMPRESSOR", 0.95),
            new Alias("compressor", "AIR_COMPRESSOR", 0.80),
            new Alias("oily water separator", "OILY_WATER_SEPARATOR", 0.95),
            new Alias("ows", "OILY_WATER_SEPARATOR", 0.80),
            new Alias("sewage treatment plant", "SEWAGE_TREATMENT_PLANT", 0.95),
            new Alias("boiler", "BOILER", 0.90),
            new Alias("gearbox", "GEARBOX", 0.90),
            new Alias("turbocharger", "TURBOCHARGER", 0.90),
            new Alias("radar", "RADAR", 0.90),
            new Alias("autopilot", "AUTOPILOT", 0.90),
            new Alias("tender", "TENDER", 0.80)
    );

    public static final List<Alias> SYSTEMS = List.of(
            new Alias("fuel system", "FUEL_SYSTEM", 0.90),
            new Alias("cooling system", "COOLING_SYSTEM", 0.90),
            new Alias("coolant system", "COOLING_SYSTEM", 0.90),
            new Alias("lube oil system", "LUBE_OIL_SYSTEM", 0.90),
            new Alias("lubrication system", "LUBE_OIL_SYSTEM", 0.90),
            new Alias("hydraulic system", "HYDRAULIC_SYSTEM", 0.90),
            new Alias("hydraulics", "HYDRAULIC_SYSTEM", 0.85),
            new Alias("electrical system", "ELECTRICAL_SYSTEM", 0.90),
            new Alias("exhaust system", "EXHAUST_SYSTEM", 0.90),
            new Alias("bilge system", "BILGE_SYSTEM", 0.90),
            new Alias("fresh water system", "FRESH_WATER_SYSTEM", 0.90),
            new Alias("navigation system", "NAVIGATION_SYSTEM", 0.90),
            new Alias("nav system", "NAVIGATION_SYSTEM", 0.85),
            new Alias("propulsion system", "PROPULSION_SYSTEM", 0.90),
            new Alias("propulsion", "PROPULSION_SYSTEM", 0.80),
            new Alias("fire suppression system", "FIRE_SUPPRESSION_SYSTEM", 0.90),
            new Alias("fire suppression", "FIRE_SUPPRESSION_SYSTEM", 0.85)
    );

    public static final List<Alias> PARTS = List.of(
            new Alias("impeller", "IMPELLER", 0.85),
            new Alias("oil filter", "OIL_FILTER", 0.85),
            new Alias("fuel filter", "FUEL_FILTER", 0.85),
            new Alias("air filter", "AIR_FILTER", 0.85),
            new Alias("filters", "FILTER", 0.60),
            new Alias("filter", "FILTER", 0.60),
            new Alias("fuel injector", "FUEL_INJECTOR", 0.85),
            new Alias("injectors", "FUEL_INJECTOR", 0.80),
            new Alias("injector", "FUEL_INJECTOR", 0.80),
            new Alias("gasket", "GASKET", 0.80),
            new Alias("o-ring", "O_RING", 0.80),
            new Alias("o ring", "O_RING", 0.80),
            new Alias("mechanical seal", "MECHANICAL_SEAL", 0.85),
            new Alias("seal", "SEAL", 0.70),
            new Alias("bearing", "BEARING", 0.80),
            new Alias("v-belt", "BELT", 0.80),
            new Alias("belt", "BELT", 0.75),
            new Alias("anodes", "ANODE", 0.80),
            new Alias("anode", "ANODE", 0.80),
            new Alias("zincs", "ANODE", 0.80),
            new Alias("thermostat", "THERMOSTAT", 0.80),
            new Alias("exhaust manifold", "EXHAUST_MANIFOLD", 0.85),
            new Alias("manifold", "MANIFOLD", 0.75),
            new Alias("membrane", "MEMBRANE", 0.80),
            new Alias("starter motor", "STARTER_MOTOR", 0.85),
            new Alias("alternator", "ALTERNATOR", 0.80),
            new Alias("heat exchanger", "HEAT_EXCHANGER", 0.85),
            new Alias("strainer", "STRAINER", 0.80)
    );

    public static final List<Alias> MARITIME_TERMS = List.of(
            new Alias("coolant leak", "COOLANT_LEAK", 0.85),
            new Alias("oil leak", "OIL_LEAK", 0.85),
            new Alias("fuel leak", "FUEL_LEAK", 0.85),
            new Alias("leaking", "LEAK", 0.75),
            new Alias("leak", "LEAK", 0.75),
            new Alias("overheating", "OVERHEATING", 0.80),
            new Alias("overheat", "OVERHEATING", 0.80),
            new Alias("vibration", "VIBRATION", 0.80),
            new Alias("vibrating", "VIBRATION", 0.80),
            new Alias("low oil pressure", "LOW_OIL_PRESSURE", 0.85),
            new Alias("high temperature", "HIGH_TEMPERATURE", 0.80),
            new Alias("high temp", "HIGH_TEMPERATURE", 0.80),
            new Alias("black smoke", "BLACK_SMOKE", 0.85),
            new Alias("white smoke", "WHITE_SMOKE", 0.85),
            new Alias("smoke", "SMOKE", 0.70),
            new Alias("running rough", "RUNNING_ROUGH", 0.80),
            new Alias("won't start", "NO_START", 0.80),
            new Alias("not starting", "NO_START", 0.80),
            new Alias("cavitation", "CAVITATION", 0.80),
            new Alias("corrosion", "CORROSION", 0.75),
            new Alias("coolant", "COOLANT", 0.70),
            new Alias("engine room", "ENGINE_ROOM", 0.75),
            new Alias("hours of rest", "HOURS_OF_REST", 0.75),
            new Alias("alarm", "ALARM", 0.65)
    );

    /** Dictionary families keyed by type. Fault codes and measurements use pattern matchers instead. */
    public static final Map<EntityType, List<Alias>> DICTIONARIES;

    /** Lower-case alias to canonical identifier, per type. */
    public static final Map<EntityType, Map<String, String>> CANONICAL_FORMS;

    /** Tokens ignored when computing entity coverage of a query. */
    public static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "must", "shall", "can", "need", "to", "of",
            "in", "for", "on", "with", "at", "by", "from", "as", "into", "through",
            "and", "or", "but", "if", "because", "until", "while", "me", "my",
            "our", "you", "your", "it", "its", "this", "that", "these", "those",
            "what", "which", "who", "show", "find", "get", "list", "search",
            "display", "give", "tell", "see", "look", "check", "view", "all",
            "please"
    );

    static {
        var dictionaries = new EnumMap<EntityType, List<Alias>>(EntityType.class);
        dictionaries.put(EntityType.EQUIPMENT, EQUIPMENT);
        dictionaries.put(EntityType.SYSTEM, SYSTEMS);
        dictionaries.put(EntityType.PART, PARTS);
        dictionaries.put(EntityType.MARITIME_TERM, MARITIME_TERMS);
        DICTIONARIES = Collections.unmodifiableMap(dictionaries);

        var forms = new EnumMap<EntityType, Map<String, String>>(EntityType.class);
        for (var entry : dictionaries.entrySet()) {
            var byPhrase = new LinkedHashMap<String, String>();
            for (Alias alias : entry.getValue()) {
                byPhrase.put(aliasKey(alias.phrase()), alias.canonical());
            }
            forms.put(entry.getKey(), Collections.unmodifiableMap(byPhrase));
        }
        CANONICAL_FORMS = Collections.unmodifiableMap(forms);
    }

    private PatternTables() {} // static tables

    /**
     * Lookup key for an alias or a matched surface form: lower case, whitespace collapsed,
     * typographic apostrophes folded to ASCII.
     */
    public static String aliasKey(String text) {
        return WHITESPACE_RUN.replaceAll(text.trim().toLowerCase(Locale.ROOT), " ")
                .replace('\u2019', '\'');
    }
}
