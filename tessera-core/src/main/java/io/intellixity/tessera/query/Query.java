package io.intellixity.tessera.query;

import io.intellixity.tessera.names.Cut;
import io.intellixity.tessera.names.Drilldown;
import io.intellixity.tessera.names.MeasureName;
import io.intellixity.tessera.names.PropertyName;

import java.util.ArrayList;
import java.util.List;

/**
 * Dialect-independent request against one cube.
 * <p>
 * Built once per request (usually through {@link QueryOptions#toQuery()}) and discarded after compilation.
 */
public final class Query {
  private List<Drilldown> drilldowns = new ArrayList<>();
  private List<Cut> cuts = new ArrayList<>();
  private List<MeasureName> measures = new ArrayList<>();
  private List<PropertyName> properties = new ArrayList<>();
  private List<FilterQuery> filters = new ArrayList<>();
  private List<PropertyName> captions = new ArrayList<>();
  private boolean parents;
  private boolean debug;
  private boolean sparse;
  private boolean excludeDefaultMembers;
  private TopQuery top;
  private TopWhereQuery topWhere;
  private SortQuery sort;
  private LimitQuery limit;
  private GrowthQuery growth;
  private RcaQuery rca;
  private RateQuery rate;

  public Query() {}

  public List<Drilldown> drilldowns() { return drilldowns; }
  public List<Cut> cuts() { return cuts; }
  public List<MeasureName> measures() { return measures; }
  public List<PropertyName> properties() { return properties; }
  public List<FilterQuery> filters() { return filters; }
  public List<PropertyName> captions() { return captions; }
  public boolean parents() { return parents; }
  public boolean debug() { return debug; }
  /** When false (the default) every drilldown member combination is returned, with null measures where no data exists. */
  public boolean sparse() { return sparse; }
  public boolean excludeDefaultMembers() { return excludeDefaultMembers; }
  public TopQuery top() { return top; }
  public TopWhereQuery topWhere() { return topWhere; }
  public SortQuery sort() { return sort; }
  public LimitQuery limit() { return limit; }
  public GrowthQuery growth() { return growth; }
  public RcaQuery rca() { return rca; }
  public RateQuery rate() { return rate; }

  public Query withDrilldowns(List<Drilldown> drilldowns) { this.drilldowns = copy(drilldowns); return this; }
  public Query withCuts(List<Cut> cuts) { this.cuts = copy(cuts); return this; }
  public Query withMeasures(List<MeasureName> measures) { this.measures = copy(measures); return this; }
  public Query withProperties(List<PropertyName> properties) { this.properties = copy(properties); return this; }
  public Query withFilters(List<FilterQuery> filters) { this.filters = copy(filters); return this; }
  public Query withCaptions(List<PropertyName> captions) { this.captions = copy(captions); return this; }
  public Query withParents(boolean parents) { this.parents = parents; return this; }
  public Query withDebug(boolean debug) { this.debug = debug; return this; }
  public Query withSparse(boolean sparse) { this.sparse = sparse; return this; }
  public Query withExcludeDefaultMembers(boolean exclude) { this.excludeDefaultMembers = exclude; return this; }
  public Query withTop(TopQuery top) { this.top = top; return this; }
  public Query withTopWhere(TopWhereQuery topWhere) { this.topWhere = topWhere; return this; }
  public Query withSort(SortQuery sort) { this.sort = sort; return this; }
  public Query withLimit(LimitQuery limit) { this.limit = limit; return this; }
  public Query withGrowth(GrowthQuery growth) { this.growth = growth; return this; }
  public Query withRca(RcaQuery rca) { this.rca = rca; return this; }
  public Query withRate(RateQuery rate) { this.rate = rate; return this; }

  public Query drilldown(String level) { this.drilldowns.add(Drilldown.parse(level)); return this; }
  public Query cut(String cut) { this.cuts.add(Cut.parse(cut)); return this; }
  public Query measure(String measure) { this.measures.add(MeasureName.parse(measure)); return this; }
  public Query property(String property) { this.properties.add(PropertyName.parse(property)); return this; }
  public Query caption(String caption) { this.captions.add(PropertyName.parse(caption)); return this; }

  private static <T> List<T> copy(List<T> in) {
    return new ArrayList<>(in == null ? List.of() : in);
  }
}
