package com.gentoro.docgen.contracts;

import java.util.List;
import java.util.Map;

public class SampleObject1 {
  public String samplePropertyString1;
  public int samplePropertyInt;
  public long sampleTimestamp;
  public List<String> tags;
  public Map<String, Integer> counters;
  public SampleStatus status;
  public SampleObject1 parent;

  private boolean archived;

  public boolean isArchived() {
    return archived;
  }
}
