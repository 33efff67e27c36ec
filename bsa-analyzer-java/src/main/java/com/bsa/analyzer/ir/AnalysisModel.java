package com.bsa.analyzer.ir;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * POJOs of the {@code analysis.json} export.
 * Field names use @SerializedName for JSON snake_case mapping; locations are {@code [line, column]}.
 */
public final class AnalysisModel {

    private AnalysisModel() {}

    public static class AnalysisRoot {
        @SerializedName("tool_version") public String toolVersion;
        @SerializedName("project")      public String project;
        @SerializedName("contracts")    public List<ContractEntry> contracts;
    }

    public static class ContractEntry {
        @SerializedName("name")        public String name;
        @SerializedName("pragma")      public String pragma;
        @SerializedName("location")    public List<Integer> location;
        @SerializedName("state_vars")  public List<StateVarEntry> stateVars;
        @SerializedName("functions")   public Map<String, FunctionEntry> functions;
        @SerializedName("events")      public List<EventEntry> events;
        @SerializedName("entrypoints") public List<EntrypointEntry> entrypoints;
        @SerializedName("findings")    public List<FindingEntry> findings;
    }

    public static class StateVarEntry {
        @SerializedName("name")     public String name;
        @SerializedName("type")     public String type;
        @SerializedName("location") public List<Integer> location;
    }

    public static class FunctionEntry {
        @SerializedName("visibility") public String visibility;
        @SerializedName("location")   public List<Integer> location;
    }

    public static class EventEntry {
        @SerializedName("name")     public String name;
        @SerializedName("location") public List<Integer> location;
    }

    public static class EntrypointEntry {
        @SerializedName("name")       public String name;
        @SerializedName("visibility") public String visibility;
        @SerializedName("location")   public List<Integer> location;
        @SerializedName("ssa")        public List<BlockEntry> ssa;
        @SerializedName("calls")      public List<CallEntry> calls;
    }

    public static class BlockEntry {
        @SerializedName("id")         public String id;
        @SerializedName("statements") public List<String> statements;
        @SerializedName("terminator") public String terminator;
        @SerializedName("reads")      public List<String> reads;
        @SerializedName("writes")     public List<String> writes;
    }

    public static class CallEntry {
        @SerializedName("name")        public String name;
        @SerializedName("call_type")   public String callType;
        @SerializedName("in_contract") public boolean inContract;
        @SerializedName("is_external") public boolean isExternal;
        @SerializedName("location")    public List<Integer> location;
    }

    public static class FindingEntry {
        @SerializedName("detector")    public String detector;
        @SerializedName("function")    public String function;
        @SerializedName("description") public String description;
        @SerializedName("severity")    public String severity;
    }
}
