/*
 * Copyright © 2011-2024 Chris Vest (mr.chrisvest@gmail.com)
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
/**
 * Cistern is a bounded, thread-safe resource pool with blocking acquisition and
 * scoped release.
 * <p>
 * Pools are built from a {@link cistern.Factory} with {@link cistern.Pool#from(Factory)},
 * and hand out {@link cistern.Lease leases} on the resources they create. Released
 * resources are restored by a {@link cistern.ResetHook} and reused. Waiting threads are
 * served in arrival order.
 * <p>
 * {@link cistern.SizeClassPools} keeps one pool per rounded problem size.
 */
package cistern;
