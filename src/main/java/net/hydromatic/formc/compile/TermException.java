/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.formc.compile;

import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.ast.Pos;

/**
 * Error in an integral: its integrand is not valid for the kind of domain it
 * is integrated over, or the representation requested for it cannot be
 * applied.
 *
 * <p>The message names the integral type and subdomain id.
 */
public class TermException extends CompileException {
  public final IntegralType type;
  public final int subdomainId;

  public TermException(String message, IntegralType type, int subdomainId) {
    super(message + " (" + type.measureName + ", subdomain " + subdomainId
        + ")", Pos.ZERO);
    this.type = type;
    this.subdomainId = subdomainId;
  }
}

// End TermException.java
