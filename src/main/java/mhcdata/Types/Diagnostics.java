/*
 * Copyright 2016-2019 The Hong Kong University of Science and Technology
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package mhcdata.Types;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;

import java.util.*;

/**
 * What one pipeline component did to its rows: the row count before and after each stage, the distinct allele
 * names that could not be parsed (first-seen order), and optionally a per-allele measurement count keyed by stage.
 */
public class Diagnostics {

    private final String sourceName;
    private final String path;
    private final List<StageCount> stageList = new ArrayList<>();
    private final Set<String> unparseableAlleleSet = new LinkedHashSet<>();
    private final Map<String, ImmutableMultiset<String>> alleleCountMap = new LinkedHashMap<>();

    public Diagnostics(String sourceName, String path) {
        this.sourceName = sourceName;
        this.path = path;
    }

    public void recordStage(String stage, int rowsBefore, int rowsAfter) {
        stageList.add(new StageCount(stage, rowsBefore, rowsAfter));
    }

    public void addUnparseableAllele(String rawAllele) {
        unparseableAlleleSet.add(String.valueOf(rawAllele));
    }

    public void recordAlleleCounts(String stage, Multiset<String> alleleCounts) {
        alleleCountMap.put(stage, Multisets.copyHighestCountFirst(alleleCounts));
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getPath() {
        return path;
    }

    public List<StageCount> getStageList() {
        return ImmutableList.copyOf(stageList);
    }

    public Set<String> getUnparseableAlleleSet() {
        return ImmutableSet.copyOf(unparseableAlleleSet);
    }

    public Map<String, ImmutableMultiset<String>> getAlleleCountMap() {
        return Collections.unmodifiableMap(alleleCountMap);
    }

    public StageCount getStage(String stage) {
        for (StageCount stageCount : stageList) {
            if (stageCount.stage.contentEquals(stage)) {
                return stageCount;
            }
        }
        return null;
    }
}
