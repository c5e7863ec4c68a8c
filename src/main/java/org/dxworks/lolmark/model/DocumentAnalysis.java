package org.dxworks.lolmark.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class DocumentAnalysis {
    public String filePath;
    public String language = "lolmark";
    public boolean valid;
    public int tokens;
    public Map<String, Integer> constructs = new TreeMap<>(); // construct name -> occurrences
    public List<VariableInfo> variables = new ArrayList<>();
    public ErrorInfo error; // nullable, set when the document is invalid
}
