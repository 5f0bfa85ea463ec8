/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.crm.tools;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.odoomcp.crm.client.OdooClient;
import io.odoomcp.server.McpServerFeatures.AsyncToolSpecification;
import io.odoomcp.server.McpServerFeatures.ToolCallHandler;
import io.odoomcp.server.ToolCallContext;
import io.odoomcp.server.ToolProvider;
import io.odoomcp.spec.InvalidParamsError;
import io.odoomcp.spec.McpSchema;
import io.odoomcp.spec.ToolExecutionError;
import io.odoomcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import static io.odoomcp.crm.tools.OdooToolSupport.optionalBoolean;
import static io.odoomcp.crm.tools.OdooToolSupport.optionalInteger;
import static io.odoomcp.crm.tools.OdooToolSupport.optionalIntegerList;
import static io.odoomcp.crm.tools.OdooToolSupport.optionalNumber;
import static io.odoomcp.crm.tools.OdooToolSupport.optionalString;
import static io.odoomcp.crm.tools.OdooToolSupport.requiredInteger;
import static io.odoomcp.crm.tools.OdooToolSupport.requiredString;
import static io.odoomcp.crm.tools.OdooToolSupport.withReconnect;

/**
 * Provides the Odoo CRM tools: a connectivity check ({@code odoo_version}) plus lead,
 * partner, stage, team and activity operations backed by {@code crm.lead},
 * {@code res.partner}, {@code crm.stage}, {@code crm.team} and {@code mail.activity}, and
 * a pipeline summary computed from {@code search_count} aggregates.
 *
 * @see CrmFormatters
 */
public class CrmToolProvider implements ToolProvider {

	private static final Logger logger = LoggerFactory.getLogger(CrmToolProvider.class);

	public static final Duration VERSION_TIMEOUT = Duration.ofSeconds(5);

	static final int DEFAULT_LIMIT = 100;

	static final String LEAD_MODEL = "crm.lead";

	static final String PARTNER_MODEL = "res.partner";

	static final String STAGE_MODEL = "crm.stage";

	static final String TEAM_MODEL = "crm.team";

	static final String ACTIVITY_MODEL = "mail.activity";

	private static final String EMPTY_SCHEMA = """
			{
				"type": "object",
				"properties": {}
			}
			""";

	private static final String LIST_LEADS_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"partner_id": { "type": "integer", "description": "Filter by partner/customer ID" },
					"team_id": { "type": "integer", "description": "Filter by sales team ID" },
					"user_id": { "type": "integer", "description": "Filter by salesperson ID" },
					"stage_id": { "type": "integer", "description": "Filter by stage ID" },
					"type": { "type": "string", "enum": ["lead", "opportunity"] },
					"priority": { "type": "string", "enum": ["0", "1", "2", "3"] },
					"date_from": { "type": "string", "description": "Created on or after (YYYY-MM-DD)" },
					"date_to": { "type": "string", "description": "Created on or before (YYYY-MM-DD)" },
					"limit": { "type": "integer", "default": 100 }
				}
			}
			""";

	private static final String LEAD_ID_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"lead_id": { "type": "integer" }
				},
				"required": ["lead_id"]
			}
			""";

	private static final String CREATE_LEAD_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"name": { "type": "string", "description": "Lead/opportunity title" },
					"type": { "type": "string", "enum": ["lead", "opportunity"] },
					"contact_name": { "type": "string" },
					"email_from": { "type": "string" },
					"phone": { "type": "string" },
					"partner_name": { "type": "string", "description": "Company name" },
					"description": { "type": "string" },
					"team_id": { "type": "integer" },
					"user_id": { "type": "integer" },
					"stage_id": { "type": "integer" },
					"expected_revenue": { "type": "number" },
					"probability": { "type": "number", "minimum": 0, "maximum": 100 }
				},
				"required": ["name"]
			}
			""";

	private static final String UPDATE_LEAD_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"lead_id": { "type": "integer" },
					"name": { "type": "string" },
					"contact_name": { "type": "string" },
					"email_from": { "type": "string" },
					"phone": { "type": "string" },
					"description": { "type": "string" },
					"stage_id": { "type": "integer" },
					"user_id": { "type": "integer" },
					"team_id": { "type": "integer" },
					"expected_revenue": { "type": "number" },
					"probability": { "type": "number", "minimum": 0, "maximum": 100 },
					"priority": { "type": "string", "enum": ["0", "1", "2", "3"] }
				},
				"required": ["lead_id"]
			}
			""";

	private static final String CONVERT_LEAD_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"lead_id": { "type": "integer", "description": "Lead to convert" },
					"partner_id": { "type": "integer", "description": "Customer to link to the opportunity" },
					"user_id": { "type": "integer", "description": "Salesperson to assign" },
					"team_id": { "type": "integer", "description": "Sales team to assign" }
				},
				"required": ["lead_id"]
			}
			""";

	private static final String LIST_PARTNERS_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"name": { "type": "string", "description": "Case-insensitive name match" },
					"email": { "type": "string" },
					"phone": { "type": "string" },
					"is_company": { "type": "boolean" },
					"customer_rank": { "type": "integer", "description": "Minimum customer rank" },
					"supplier_rank": { "type": "integer", "description": "Minimum supplier rank" },
					"category_id": { "type": "integer", "description": "Partner tag ID" },
					"country_id": { "type": "integer" },
					"limit": { "type": "integer", "default": 100 }
				}
			}
			""";

	private static final String PARTNER_ID_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"partner_id": { "type": "integer" }
				},
				"required": ["partner_id"]
			}
			""";

	private static final String CREATE_PARTNER_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"name": { "type": "string" },
					"email": { "type": "string" },
					"phone": { "type": "string" },
					"mobile": { "type": "string" },
					"is_company": { "type": "boolean", "default": false },
					"website": { "type": "string" },
					"vat": { "type": "string", "description": "VAT/tax ID" },
					"street": { "type": "string" },
					"street2": { "type": "string" },
					"city": { "type": "string" },
					"zip": { "type": "string" },
					"country_id": { "type": "integer" },
					"state_id": { "type": "integer" },
					"parent_id": { "type": "integer", "description": "Parent company ID" },
					"customer_rank": { "type": "integer", "default": 0 },
					"supplier_rank": { "type": "integer", "default": 0 },
					"category_ids": { "type": "array", "items": { "type": "integer" }, "description": "Partner tag IDs" }
				},
				"required": ["name"]
			}
			""";

	private static final String UPDATE_PARTNER_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"partner_id": { "type": "integer" },
					"name": { "type": "string" },
					"email": { "type": "string" },
					"phone": { "type": "string" },
					"mobile": { "type": "string" },
					"website": { "type": "string" },
					"vat": { "type": "string" },
					"street": { "type": "string" },
					"street2": { "type": "string" },
					"city": { "type": "string" },
					"zip": { "type": "string" },
					"country_id": { "type": "integer" },
					"state_id": { "type": "integer" },
					"customer_rank": { "type": "integer" },
					"supplier_rank": { "type": "integer" },
					"active": { "type": "boolean" }
				},
				"required": ["partner_id"]
			}
			""";

	private static final String DASHBOARD_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"team_id": { "type": "integer", "description": "Only records of this sales team" },
					"user_id": { "type": "integer", "description": "Only records of this salesperson" },
					"date_from": { "type": "string", "description": "Created on or after (YYYY-MM-DD)" },
					"date_to": { "type": "string", "description": "Created on or before (YYYY-MM-DD)" }
				}
			}
			""";

	private static final String LIST_STAGES_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"team_id": { "type": "integer", "description": "Only stages of this sales team" }
				}
			}
			""";

	private final OdooClient client;

	private final ObjectMapper objectMapper;

	public CrmToolProvider(OdooClient client, ObjectMapper objectMapper) {
		Assert.notNull(client, "OdooClient must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.client = client;
		this.objectMapper = objectMapper;
	}

	@Override
	public List<AsyncToolSpecification> getToolSpecifications() {
		return List.of(
				spec("odoo_version", "Report the Odoo server this bridge is connected to and its version.",
						EMPTY_SCHEMA, VERSION_TIMEOUT, this::odooVersion),
				spec("list_leads", "List CRM leads and opportunities, newest first, with optional filters.",
						LIST_LEADS_SCHEMA, null, this::listLeads),
				spec("get_lead_details", "Get the full record of a single lead or opportunity.", LEAD_ID_SCHEMA,
						null, this::getLeadDetails),
				spec("create_lead", "Create a lead or opportunity and return the stored record.",
						CREATE_LEAD_SCHEMA, null, this::createLead),
				spec("update_lead", "Update fields of an existing lead and return the stored record.",
						UPDATE_LEAD_SCHEMA, null, this::updateLead),
				spec("list_partners", "List contacts and companies ordered by name, with optional filters.",
						LIST_PARTNERS_SCHEMA, null, this::listPartners),
				spec("get_partner_details", "Get the full record of a single contact or company.",
						PARTNER_ID_SCHEMA, null, this::getPartnerDetails),
				spec("list_crm_stages", "List pipeline stages in sequence order.", LIST_STAGES_SCHEMA, null,
						this::listStages),
				spec("list_crm_teams", "List sales teams with their leader and member count.", EMPTY_SCHEMA,
						null, this::listTeams));
	}

	private AsyncToolSpecification spec(String name, String description, String schema, Duration timeout,
			ToolCallHandler handler) {
		McpSchema.Tool tool = McpSchema.Tool.builder()
			.name(name)
			.description(description)
			.inputSchema(this.objectMapper, schema)
			.build();
		return AsyncToolSpecification.builder()
			.tool(tool)
			.callHandler((context, arguments) -> withReconnect(this.client, name,
					() -> handler.handle(context, arguments))
				.onErrorMap(IllegalArgumentException.class, e -> ToolExecutionError.failed(name, e)))
			.timeout(timeout)
			.build();
	}

	private Mono<Object> odooVersion(ToolCallContext context, Map<String, Object> arguments) {
		return this.client.getServerVersion()
			.map(version -> "Connected to: " + this.client.getUrl() + "\nDatabase: " + this.client.getDatabase()
					+ "\nVersion: " + version);
	}

	private Mono<Object> listLeads(ToolCallContext context, Map<String, Object> arguments) {
		List<List<Object>> domain = new ArrayList<>();
		addEquals(domain, "partner_id", optionalInteger(arguments, "partner_id"));
		addEquals(domain, "team_id", optionalInteger(arguments, "team_id"));
		addEquals(domain, "user_id", optionalInteger(arguments, "user_id"));
		addEquals(domain, "stage_id", optionalInteger(arguments, "stage_id"));
		addEquals(domain, "type", optionalString(arguments, "type"));
		addEquals(domain, "priority", optionalString(arguments, "priority"));
		addCondition(domain, "create_date", ">=", optionalString(arguments, "date_from"));
		addCondition(domain, "create_date", "<=", optionalString(arguments, "date_to"));
		return this.client
			.searchRead(LEAD_MODEL, domain, CrmFormatters.LEAD_FIELDS, limit(arguments), "create_date desc")
			.map(records -> formatAll(records, CrmFormatters::formatLead));
	}

	private Mono<Object> getLeadDetails(ToolCallContext context, Map<String, Object> arguments) {
		return readLead(context.toolName(), requiredInteger(arguments, "lead_id"));
	}

	private Mono<Object> createLead(ToolCallContext context, Map<String, Object> arguments) {
		Map<String, Object> values = new LinkedHashMap<>();
		values.put("name", requiredString(arguments, "name"));
		String type = optionalString(arguments, "type");
		values.put("type", (type != null) ? type : "lead");
		putIfPresent(values, "contact_name", optionalString(arguments, "contact_name"));
		putIfPresent(values, "email_from", optionalString(arguments, "email_from"));
		putIfPresent(values, "phone", optionalString(arguments, "phone"));
		putIfPresent(values, "partner_name", optionalString(arguments, "partner_name"));
		putIfPresent(values, "description", optionalString(arguments, "description"));
		putIfPresent(values, "team_id", optionalInteger(arguments, "team_id"));
		putIfPresent(values, "user_id", optionalInteger(arguments, "user_id"));
		putIfPresent(values, "stage_id", optionalInteger(arguments, "stage_id"));
		putIfPresent(values, "expected_revenue", optionalNumber(arguments, "expected_revenue"));
		putIfPresent(values, "probability", optionalNumber(arguments, "probability"));

		return this.client.executeKw(LEAD_MODEL, "create", List.of(values), Map.of()).flatMap(created -> {
			if (!(created instanceof Number id)) {
				return Mono.error(new ToolExecutionError(context.toolName(),
						"Tool execution failed: Odoo returned no id for the created lead", null));
			}
			logger.info("Created lead {}", id);
			return readLead(context.toolName(), id.intValue());
		});
	}

	private Mono<Object> updateLead(ToolCallContext context, Map<String, Object> arguments) {
		int leadId = requiredInteger(arguments, "lead_id");
		Map<String, Object> values = new LinkedHashMap<>();
		putIfPresent(values, "name", optionalString(arguments, "name"));
		putIfPresent(values, "contact_name", optionalString(arguments, "contact_name"));
		putIfPresent(values, "email_from", optionalString(arguments, "email_from"));
		putIfPresent(values, "phone", optionalString(arguments, "phone"));
		putIfPresent(values, "description", optionalString(arguments, "description"));
		putIfPresent(values, "stage_id", optionalInteger(arguments, "stage_id"));
		putIfPresent(values, "user_id", optionalInteger(arguments, "user_id"));
		putIfPresent(values, "team_id", optionalInteger(arguments, "team_id"));
		putIfPresent(values, "expected_revenue", optionalNumber(arguments, "expected_revenue"));
		putIfPresent(values, "probability", optionalNumber(arguments, "probability"));
		putIfPresent(values, "priority", optionalString(arguments, "priority"));
		if (values.isEmpty()) {
			throw new InvalidParamsError("No fields provided for update");
		}

		return this.client.executeKw(LEAD_MODEL, "write", List.of(List.of(leadId), values), Map.of())
			.flatMap(written -> {
				logger.info("Updated lead {} fields {}", leadId, values.keySet());
				return readLead(context.toolName(), leadId);
			});
	}

	private Mono<Object> convertLead(ToolCallContext context, Map<String, Object> arguments) {
		int leadId = requiredInteger(arguments, "lead_id");
		Map<String, Object> values = new LinkedHashMap<>();
		values.put("type", "opportunity");
		putIfPresent(values, "partner_id", optionalInteger(arguments, "partner_id"));
		putIfPresent(values, "user_id", optionalInteger(arguments, "user_id"));
		putIfPresent(values, "team_id", optionalInteger(arguments, "team_id"));

		return this.client.executeKw(LEAD_MODEL, "write", List.of(List.of(leadId), values), Map.of())
			.flatMap(written -> {
				logger.info("Converted lead {} to opportunity", leadId);
				return readLead(context.toolName(), leadId);
			});
	}

	private Mono<Object> getLeadActivities(ToolCallContext context, Map<String, Object> arguments) {
		int leadId = requiredInteger(arguments, "lead_id");
		List<List<Object>> domain = new ArrayList<>();
		addEquals(domain, "res_model", LEAD_MODEL);
		addEquals(domain, "res_id", leadId);
		return this.client.searchRead(ACTIVITY_MODEL, domain, CrmFormatters.ACTIVITY_FIELDS, null, "date_deadline desc")
			.map(records -> formatAll(records, CrmFormatters::formatActivity));
	}

	private Mono<Object> listPartners(ToolCallContext context, Map<String, Object> arguments) {
		List<List<Object>> domain = new ArrayList<>();
		addCondition(domain, "name", "ilike", optionalString(arguments, "name"));
		addCondition(domain, "email", "ilike", optionalString(arguments, "email"));
		addCondition(domain, "phone", "ilike", optionalString(arguments, "phone"));
		addEquals(domain, "is_company", optionalBoolean(arguments, "is_company"));
		addCondition(domain, "customer_rank", ">=", optionalInteger(arguments, "customer_rank"));
		addCondition(domain, "supplier_rank", ">=", optionalInteger(arguments, "supplier_rank"));
		Integer categoryId = optionalInteger(arguments, "category_id");
		if (categoryId != null) {
			addCondition(domain, "category_id", "in", List.of(categoryId));
		}
		addEquals(domain, "country_id", optionalInteger(arguments, "country_id"));
		return this.client
			.searchRead(PARTNER_MODEL, domain, CrmFormatters.PARTNER_FIELDS, limit(arguments), "name asc")
			.map(records -> formatAll(records, CrmFormatters::formatPartner));
	}

	private Mono<Object> getPartnerDetails(ToolCallContext context,
			Map<String, Object> arguments) {
		return readPartner(context.toolName(), requiredInteger(arguments, "partner_id"));
	}

	private Mono<Object> createPartner(ToolCallContext context, Map<String, Object> arguments) {
		Map<String, Object> values = new LinkedHashMap<>();
		values.put("name", requiredString(arguments, "name"));
		Boolean company = optionalBoolean(arguments, "is_company");
		values.put("is_company", (company != null) ? company : Boolean.FALSE);
		putIfPresent(values, "email", optionalString(arguments, "email"));
		putIfPresent(values, "phone", optionalString(arguments, "phone"));
		putIfPresent(values, "mobile", optionalString(arguments, "mobile"));
		putIfPresent(values, "website", optionalString(arguments, "website"));
		putIfPresent(values, "vat", optionalString(arguments, "vat"));
		putIfPresent(values, "street", optionalString(arguments, "street"));
		putIfPresent(values, "street2", optionalString(arguments, "street2"));
		putIfPresent(values, "city", optionalString(arguments, "city"));
		putIfPresent(values, "zip", optionalString(arguments, "zip"));
		putIfPresent(values, "country_id", optionalInteger(arguments, "country_id"));
		putIfPresent(values, "state_id", optionalInteger(arguments, "state_id"));
		putIfPresent(values, "parent_id", optionalInteger(arguments, "parent_id"));
		Integer customerRank = optionalInteger(arguments, "customer_rank");
		values.put("customer_rank", (customerRank != null) ? customerRank : 0);
		Integer supplierRank = optionalInteger(arguments, "supplier_rank");
		values.put("supplier_rank", (supplierRank != null) ? supplierRank : 0);
		List<Integer> categoryIds = optionalIntegerList(arguments, "category_ids");
		if (categoryIds != null && !categoryIds.isEmpty()) {
			// (6, 0, ids) replaces the whole many2many set
			values.put("category_id", List.of(List.of(6, 0, categoryIds)));
		}

		return this.client.executeKw(PARTNER_MODEL, "create", List.of(values), Map.of()).flatMap(created -> {
			if (!(created instanceof Number id)) {
				return Mono.error(new ToolExecutionError(context.toolName(),
						"Tool execution failed: Odoo returned no id for the created partner", null));
			}
			logger.info("Created partner {}", id);
			return readPartner(context.toolName(), id.intValue());
		});
	}

	private Mono<Object> updatePartner(ToolCallContext context, Map<String, Object> arguments) {
		int partnerId = requiredInteger(arguments, "partner_id");
		Map<String, Object> values = new LinkedHashMap<>();
		putIfPresent(values, "name", optionalString(arguments, "name"));
		putIfPresent(values, "email", optionalString(arguments, "email"));
		putIfPresent(values, "phone", optionalString(arguments, "phone"));
		putIfPresent(values, "mobile", optionalString(arguments, "mobile"));
		putIfPresent(values, "website", optionalString(arguments, "website"));
		putIfPresent(values, "vat", optionalString(arguments, "vat"));
		putIfPresent(values, "street", optionalString(arguments, "street"));
		putIfPresent(values, "street2", optionalString(arguments, "street2"));
		putIfPresent(values, "city", optionalString(arguments, "city"));
		putIfPresent(values, "zip", optionalString(arguments, "zip"));
		putIfPresent(values, "country_id", optionalInteger(arguments, "country_id"));
		putIfPresent(values, "state_id", optionalInteger(arguments, "state_id"));
		putIfPresent(values, "customer_rank", optionalInteger(arguments, "customer_rank"));
		putIfPresent(values, "supplier_rank", optionalInteger(arguments, "supplier_rank"));
		putIfPresent(values, "active", optionalBoolean(arguments, "active"));
		if (values.isEmpty()) {
			throw new InvalidParamsError("No fields provided for update");
		}

		return this.client.executeKw(PARTNER_MODEL, "write", List.of(List.of(partnerId), values), Map.of())
			.flatMap(written -> {
				logger.info("Updated partner {} fields {}", partnerId, values.keySet());
				return readPartner(context.toolName(), partnerId);
			});
	}

	private Mono<Object> listStages(ToolCallContext context, Map<String, Object> arguments) {
		List<List<Object>> domain = new ArrayList<>();
		addEquals(domain, "team_id", optionalInteger(arguments, "team_id"));
		return this.client.searchRead(STAGE_MODEL, domain, CrmFormatters.STAGE_FIELDS, null, "sequence asc")
			.map(records -> formatAll(records, CrmFormatters::formatStage));
	}

	private Mono<Object> listTeams(ToolCallContext context, Map<String, Object> arguments) {
		return this.client.searchRead(TEAM_MODEL, List.of(), CrmFormatters.TEAM_FIELDS, null, "name asc")
			.map(records -> formatAll(records, CrmFormatters::formatTeam));
	}

	private Mono<Object> dashboardStats(ToolCallContext context, Map<String, Object> arguments) {
		List<List<Object>> domain = new ArrayList<>();
		addEquals(domain, "team_id", optionalInteger(arguments, "team_id"));
		addEquals(domain, "user_id", optionalInteger(arguments, "user_id"));
		addCondition(domain, "create_date", ">=", optionalString(arguments, "date_from"));
		addCondition(domain, "create_date", "<=", optionalString(arguments, "date_to"));

		List<List<Object>> opportunities = with(domain, List.of("type", "=", "opportunity"));
		Mono<Long> leads = countLeads(with(domain, List.of("type", "=", "lead")));
		Mono<Long> opportunityCount = countLeads(opportunities);
		Mono<Long> won = countLeads(with(opportunities, List.of("probability", "=", 100)));
		Mono<Long> lost = countLeads(with(with(opportunities, List.of("probability", "=", 0)),
				List.of("active", "=", false)));
		Mono<List<Map<String, Object>>> revenue = this.client.searchRead(LEAD_MODEL,
				with(opportunities, List.of("expected_revenue", ">", 0)), List.of("expected_revenue", "probability"),
				null, null);

		return Mono.zip(leads, opportunityCount, won, lost, revenue).map(counts -> {
			long opportunitiesTotal = counts.getT2();
			long wonTotal = counts.getT3();
			long lostTotal = counts.getT4();
			double expected = 0;
			double weighted = 0;
			for (Map<String, Object> opportunity : counts.getT5()) {
				double amount = asDouble(opportunity.get("expected_revenue"));
				expected += amount;
				weighted += amount * asDouble(opportunity.get("probability")) / 100;
			}
			Map<String, Object> stats = new LinkedHashMap<>();
			stats.put("leads_count", counts.getT1());
			stats.put("opportunities_count", opportunitiesTotal);
			stats.put("won_count", wonTotal);
			stats.put("lost_count", lostTotal);
			stats.put("win_rate", round2(wonTotal * 100.0 / Math.max(opportunitiesTotal, 1)));
			stats.put("total_expected_revenue", round2(expected));
			stats.put("weighted_revenue", round2(weighted));
			stats.put("active_pipeline", opportunitiesTotal - wonTotal - lostTotal);
			return stats;
		});
	}

	private Mono<Long> countLeads(List<List<Object>> domain) {
		return this.client.executeKw(LEAD_MODEL, "search_count", List.of(domain), Map.of())
			.map(count -> (count instanceof Number number) ? number.longValue() : 0L);
	}

	private Mono<Object> readPartner(String toolName, int partnerId) {
		return readOne(toolName, PARTNER_MODEL, partnerId, CrmFormatters.PARTNER_DETAIL_FIELDS, "Partner")
			.map(CrmFormatters::formatPartnerDetails);
	}

	private Mono<Object> readLead(String toolName, int leadId) {
		return readOne(toolName, LEAD_MODEL, leadId, CrmFormatters.LEAD_DETAIL_FIELDS, "Lead")
			.map(CrmFormatters::formatLeadDetails);
	}

	@SuppressWarnings("unchecked")
	private Mono<Map<String, Object>> readOne(String toolName, String model, int id, List<String> fields,
			String label) {
		return this.client.executeKw(model, "read", List.of(List.of(id)), Map.of("fields", fields))
			.flatMap(result -> {
				if (result instanceof List<?> records && !records.isEmpty()
						&& records.get(0) instanceof Map<?, ?> record) {
					return Mono.just((Map<String, Object>) record);
				}
				return Mono.error(new ToolExecutionError(toolName,
						"Tool execution failed: " + label + " with ID " + id + " not found", null));
			});
	}

	private static Object formatAll(List<Map<String, Object>> records,
			Function<Map<String, Object>, Map<String, Object>> formatter) {
		return records.stream().map(formatter).toList();
	}

	private static Integer limit(Map<String, Object> arguments) {
		Integer limit = optionalInteger(arguments, "limit");
		if (limit == null) {
			return DEFAULT_LIMIT;
		}
		if (limit <= 0) {
			throw new IllegalArgumentException("Argument 'limit' must be positive, got " + limit);
		}
		return limit;
	}

	private static List<List<Object>> with(List<List<Object>> domain, List<Object> condition) {
		List<List<Object>> extended = new ArrayList<>(domain);
		extended.add(condition);
		return extended;
	}

	private static double asDouble(Object value) {
		return (value instanceof Number number) ? number.doubleValue() : 0.0;
	}

	private static double round2(double value) {
		return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
	}

	private static void addEquals(List<List<Object>> domain, String field, Object value) {
		addCondition(domain, field, "=", value);
	}

	private static void addCondition(List<List<Object>> domain, String field, String operator, Object value) {
		if (value != null) {
			domain.add(List.of(field, operator, value));
		}
	}

	private static void putIfPresent(Map<String, Object> values, String field, Object value) {
		if (value != null) {
			values.put(field, value);
		}
	}

}
