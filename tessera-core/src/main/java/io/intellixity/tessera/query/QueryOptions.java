package io.intellixity.tessera.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tessera.names.Cut;
import io.intellixity.tessera.names.Drilldown;
import io.intellixity.tessera.names.MeasureName;
import io.intellixity.tessera.names.NameParseException;
import io.intellixity.tessera.names.PropertyName;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Raw request options, as received from a caller (e.g. decoded from JSON with snake_case keys).
 * <p>
 * {@link #toQuery()} parses every textual value; the first malformed value fails the whole request.
 */
public final class QueryOptions {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @JsonProperty("drilldowns") private List<String> drilldowns = new ArrayList<>();
  @JsonProperty("cuts") private List<String> cuts = new ArrayList<>();
  @JsonProperty("measures") private List<String> measures = new ArrayList<>();
  @JsonProperty("properties") private List<String> properties = new ArrayList<>();
  @JsonProperty("filters") private List<String> filters = new ArrayList<>();
  @JsonProperty("captions") private List<String> captions = new ArrayList<>();
  @JsonProperty("parents") private boolean parents;
  @JsonProperty("debug") private boolean debug;
  @JsonProperty("sparse") private boolean sparse;
  @JsonProperty("exclude_default_members") private boolean excludeDefaultMembers;
  @JsonProperty("top") private String top;
  @JsonProperty("top_where") private String topWhere;
  @JsonProperty("sort") private String sort;
  @JsonProperty("limit") private String limit;
  @JsonProperty("growth") private String growth;
  @JsonProperty("rca") private String rca;
  @JsonProperty("rate") private String rate;

  public static QueryOptions fromJson(String json) {
    try {
      return MAPPER.readValue(json, QueryOptions.class);
    } catch (IOException e) {
      throw new QueryValidationException("Could not read query options: " + e.getMessage(), e);
    }
  }

  public Query toQuery() {
    return new Query()
        .withDrilldowns(parseAll("drilldowns", drilldowns, Drilldown::parse))
        .withCuts(parseAll("cuts", cuts, Cut::parse))
        .withMeasures(parseAll("measures", measures, MeasureName::parse))
        .withProperties(parseAll("properties", properties, PropertyName::parse))
        .withFilters(parseAll("filters", filters, FilterQuery::parse))
        .withCaptions(parseAll("captions", captions, PropertyName::parse))
        .withParents(parents)
        .withDebug(debug)
        .withSparse(sparse)
        .withExcludeDefaultMembers(excludeDefaultMembers)
        .withTop(parseOne("top", top, TopQuery::parse))
        .withTopWhere(parseOne("top_where", topWhere, TopWhereQuery::parse))
        .withSort(parseOne("sort", sort, SortQuery::parse))
        .withLimit(parseOne("limit", limit, LimitQuery::parse))
        .withGrowth(parseOne("growth", growth, GrowthQuery::parse))
        .withRca(parseOne("rca", rca, RcaQuery::parse))
        .withRate(parseOne("rate", rate, RateQuery::parse));
  }

  private static <T> List<T> parseAll(String option, List<String> raw, Function<String, T> parser) {
    List<T> out = new ArrayList<>();
    if (raw == null) return out;
    for (String s : raw) out.add(parseOne(option, s, parser));
    return out;
  }

  private static <T> T parseOne(String option, String raw, Function<String, T> parser) {
    if (raw == null || raw.isBlank()) return null;
    try {
      return parser.apply(raw);
    } catch (NameParseException e) {
      throw new NameParseException("Bad value '" + raw + "' for option '" + option + "': " + e.getMessage(), e);
    } catch (QueryValidationException e) {
      throw new QueryValidationException("Bad value '" + raw + "' for option '" + option + "': " + e.getMessage(), e);
    }
  }

  public List<String> getDrilldowns() { return drilldowns; }
  public void setDrilldowns(List<String> drilldowns) { this.drilldowns = drilldowns; }
  public List<String> getCuts() { return cuts; }
  public void setCuts(List<String> cuts) { this.cuts = cuts; }
  public List<String> getMeasures() { return measures; }
  public void setMeasures(List<String> measures) { this.measures = measures; }
  public List<String> getProperties() { return properties; }
  public void setProperties(List<String> properties) { this.properties = properties; }
  public List<String> getFilters() { return filters; }
  public void setFilters(List<String> filters) { this.filters = filters; }
  public List<String> getCaptions() { return captions; }
  public void setCaptions(List<String> captions) { this.captions = captions; }
  public boolean isParents() { return parents; }
  public void setParents(boolean parents) { this.parents = parents; }
  public boolean isDebug() { return debug; }
  public void setDebug(boolean debug) { this.debug = debug; }
  public boolean isSparse() { return sparse; }
  public void setSparse(boolean sparse) { this.sparse = sparse; }
  public boolean isExcludeDefaultMembers() { return excludeDefaultMembers; }
  public void setExcludeDefaultMembers(boolean excludeDefaultMembers) { this.excludeDefaultMembers = excludeDefaultMembers; }
  public String getTop() { return top; }
  public void setTop(String top) { this.top = top; }
  public String getTopWhere() { return topWhere; }
  public void setTopWhere(String topWhere) { this.topWhere = topWhere; }
  public String getSort() { return sort; }
  public void setSort(String sort) { this.sort = sort; }
  public String getLimit() { return limit; }
  public void setLimit(String limit) { this.limit = limit; }
  public String getGrowth() { return growth; }
  public void setGrowth(String growth) { this.growth = growth; }
  public String getRca() { return rca; }
  public void setRca(String rca) { this.rca = rca; }
  public String getRate() { return rate; }
  public void setRate(String rate) { this.rate = rate; }
}
