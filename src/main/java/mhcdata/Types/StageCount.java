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

public class StageCount {

    public final String stage;
    public final int rowsBefore;
    public final int rowsAfter;

    public StageCount(String stage, int rowsBefore, int rowsAfter) {
        this.stage = stage;
        this.rowsBefore = rowsBefore;
        this.rowsAfter = rowsAfter;
    }

    public int getDroppedNum() {
        return rowsBefore - rowsAfter;
    }
}
