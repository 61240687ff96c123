/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.quotaguard.cost;

/**
 * The query text couldn't be scanned.
 */
class QueryParseException extends Exception {
  /**
   * Where in the query text the problem was found.
   */
  final int position;

  QueryParseException(String message, int position) {
    super(message + " at position " + position);
    this.position = position;
  }
}
