/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.crm.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes raw Odoo records into the maps returned by the CRM tools.
 * <p>
 * Odoo reports an empty field as {@code false} and a many2one field as an
 * {@code [id, display_name]} pair. Text fields are normalized to {@code ""} when empty and
 * many2one fields become {@code {"id", "name"}} objects or {@code null}.
 * </p>
 */
public final class CrmFormatters {

	static final List<String> LEAD_FIELDS = List.of("id", "name", "type", "contact_name", "partner_name",
			"email_from", "phone", "mobile", "expected_revenue", "probability", "priority", "create_date",
			"write_date", "date_deadline", "stage_id", "team_id", "user_id", "partner_id", "description");

	static final List<String> PARTNER_FIELDS = List.of("id", "name", "display_name", "email", "phone", "mobile",
			"website", "is_company", "customer_rank", "supplier_rank", "vat", "street", "street2", "city", "zip",
			"country_id", "state_id", "parent_id", "category_id", "create_date", "write_date", "active");

	static final List<String> LEAD_DETAIL_FIELDS = concat(LEAD_FIELDS, List.of("website", "function", "street",
			"street2", "city", "zip", "date_open", "date_closed", "date_last_stage_update", "active", "color"));

	static final List<String> PARTNER_DETAIL_FIELDS = concat(PARTNER_FIELDS,
			List.of("function", "title", "lang", "tz", "comment", "ref", "industry_id", "company_id"));

	static final List<String> STAGE_FIELDS = List.of("id", "name", "sequence", "fold", "team_id", "probability");

	static final List<String> TEAM_FIELDS = List.of("id", "name", "user_id", "member_ids", "active");

	static final List<String> ACTIVITY_FIELDS = List.of("id", "activity_type_id", "summary", "date_deadline",
			"user_id", "state", "create_date");

	private CrmFormatters() {
	}

	public static Map<String, Object> formatLead(Map<String, Object> lead) {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("id", lead.get("id"));
		result.put("name", text(lead.get("name")));
		result.put("type", textOr(lead.get("type"), "lead"));
		result.put("contact_name", text(lead.get("contact_name")));
		result.put("partner_name", text(lead.get("partner_name")));
		result.put("email_from", text(lead.get("email_from")));
		result.put("phone", text(lead.get("phone")));
		result.put("mobile", text(lead.get("mobile")));
		result.put("expected_revenue", number(lead.get("expected_revenue"), 0.0));
		result.put("probability", number(lead.get("probability"), 0.0));
		result.put("priority", textOr(lead.get("priority"), "0"));
		result.put("create_date", text(lead.get("create_date")));
		result.put("write_date", text(lead.get("write_date")));
		result.put("date_deadline", text(lead.get("date_deadline")));
		result.put("stage", many2one(lead.get("stage_id")));
		result.put("team", many2one(lead.get("team_id")));
		result.put("user", many2one(lead.get("user_id")));
		result.put("partner", many2one(lead.get("partner_id")));
		result.put("description", text(lead.get("description")));
		return result;
	}

	public static Map<String, Object> formatLeadDetails(Map<String, Object> lead) {
		Map<String, Object> result = formatLead(lead);
		result.put("website", text(lead.get("website")));
		result.put("function", text(lead.get("function")));
		result.put("street", text(lead.get("street")));
		result.put("street2", text(lead.get("street2")));
		result.put("city", text(lead.get("city")));
		result.put("zip", text(lead.get("zip")));
		result.put("date_open", text(lead.get("date_open")));
		result.put("date_closed", text(lead.get("date_closed")));
		result.put("date_last_stage_update", text(lead.get("date_last_stage_update")));
		result.put("active", bool(lead.get("active"), true));
		result.put("color", number(lead.get("color"), 0));
		return result;
	}

	public static Map<String, Object> formatPartner(Map<String, Object> partner) {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("id", partner.get("id"));
		result.put("name", text(partner.get("name")));
		result.put("display_name", text(partner.get("display_name")));
		result.put("email", text(partner.get("email")));
		result.put("phone", text(partner.get("phone")));
		result.put("mobile", text(partner.get("mobile")));
		result.put("website", text(partner.get("website")));
		result.put("is_company", bool(partner.get("is_company"), false));
		result.put("customer_rank", number(partner.get("customer_rank"), 0));
		result.put("supplier_rank", number(partner.get("supplier_rank"), 0));
		result.put("vat", text(partner.get("vat")));
		result.put("street", text(partner.get("street")));
		result.put("street2", text(partner.get("street2")));
		result.put("city", text(partner.get("city")));
		result.put("zip", text(partner.get("zip")));
		result.put("country", many2one(partner.get("country_id")));
		result.put("state", many2one(partner.get("state_id")));
		result.put("parent", many2one(partner.get("parent_id")));
		result.put("categories", many2many(partner.get("category_id")));
		result.put("create_date", text(partner.get("create_date")));
		result.put("write_date", text(partner.get("write_date")));
		result.put("active", bool(partner.get("active"), true));
		return result;
	}

	public static Map<String, Object> formatPartnerDetails(Map<String, Object> partner) {
		Map<String, Object> result = formatPartner(partner);
		result.put("function", text(partner.get("function")));
		result.put("title", many2one(partner.get("title")));
		result.put("lang", text(partner.get("lang")));
		result.put("tz", text(partner.get("tz")));
		result.put("comment", text(partner.get("comment")));
		result.put("ref", text(partner.get("ref")));
		result.put("industry", many2one(partner.get("industry_id")));
		result.put("company", many2one(partner.get("company_id")));
		return result;
	}

	public static Map<String, Object> formatStage(Map<String, Object> stage) {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("id", stage.get("id"));
		result.put("name", text(stage.get("name")));
		result.put("sequence", number(stage.get("sequence"), 0));
		result.put("fold", bool(stage.get("fold"), false));
		result.put("probability", number(stage.get("probability"), 0.0));
		result.put("team", many2one(stage.get("team_id")));
		return result;
	}

	public static Map<String, Object> formatTeam(Map<String, Object> team) {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("id", team.get("id"));
		result.put("name", text(team.get("name")));
		result.put("active", bool(team.get("active"), true));
		result.put("leader", many2one(team.get("user_id")));
		result.put("member_count", (team.get("member_ids") instanceof List<?> members) ? members.size() : 0);
		return result;
	}

	public static Map<String, Object> formatActivity(Map<String, Object> activity) {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("id", activity.get("id"));
		result.put("type", many2one(activity.get("activity_type_id")));
		result.put("summary", text(activity.get("summary")));
		result.put("date_deadline", text(activity.get("date_deadline")));
		result.put("state", text(activity.get("state")));
		result.put("user", many2one(activity.get("user_id")));
		result.put("create_date", text(activity.get("create_date")));
		return result;
	}

	/**
	 * Convert an Odoo many2one value.
	 * @param value {@code [id, name]} or {@code false}
	 * @return {@code {"id", "name"}} or {@code null} when the field is empty
	 */
	static Map<String, Object> many2one(Object value) {
		if (value instanceof List<?> pair && pair.size() >= 2) {
			Map<String, Object> reference = new LinkedHashMap<>();
			reference.put("id", pair.get(0));
			reference.put("name", pair.get(1));
			return reference;
		}
		return null;
	}

	// category_id comes back either as ids or as [id, name] pairs depending on the call
	static List<Object> many2many(Object value) {
		List<Object> result = new ArrayList<>();
		if (value instanceof List<?> items) {
			for (Object item : items) {
				Map<String, Object> reference = many2one(item);
				if (reference != null) {
					result.add(reference);
				}
				else if (item instanceof Number id) {
					result.add(Map.of("id", id));
				}
			}
		}
		return result;
	}

	private static List<String> concat(List<String> first, List<String> second) {
		List<String> fields = new ArrayList<>(first);
		fields.addAll(second);
		return List.copyOf(fields);
	}

	static String text(Object value) {
		return (value instanceof String string) ? string : "";
	}

	static String textOr(Object value, String fallback) {
		return (value instanceof String string && !string.isEmpty()) ? string : fallback;
	}

	static Object number(Object value, Number fallback) {
		return (value instanceof Number) ? value : fallback;
	}

	static boolean bool(Object value, boolean fallback) {
		return (value instanceof Boolean flag) ? flag : fallback;
	}

}
