package me.golemcore.chainscope.domain.fusion;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.chainscope.domain.model.ToolResult;

import java.util.List;

/**
 * Extracts normalized records from the payload of one provider.
 *
 * <p>
 * Recognizers are pure: the same result always yields the same records. A
 * recognizer returns an empty list for payloads it does not understand; the
 * fusion engine then keeps the payload verbatim.
 */
public interface ShapeRecognizer {

    /**
     * Whether this recognizer understands payloads of the given provider.
     *
     * @param source
     *            provider tag of a tool result
     * @return true if {@link #recognize(ToolResult)} should be consulted
     */
    boolean supports(String source);

    /**
     * Extracts records from a successful result.
     *
     * @param result
     *            successful tool result
     * @return recognized records in a stable order, possibly empty
     */
    List<RecognizedRecord> recognize(ToolResult result);
}
