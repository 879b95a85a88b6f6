/**
 * Health check and user CRUD HTTP service.
 *
 * <p>Users are kept in an in-memory store for the lifetime of the process.
 * <br>Ids are assigned sequentially from 1 and never reused, even after deletion.
 *
 * <h2>Routes:</h2>
 * <pre>
 * GET    /            service discovery
 * GET    /health      {"status":"ok"}
 * GET    /users       list users
 * POST   /users       create user from {"name","email"}
 * GET    /users/{id}  get user
 * DELETE /users/{id}  delete user
 * </pre>
 *
 * <h2>Usage:</h2>
 * <pre>java -jar user-health-api.jar --config cfg/ --port 5000</pre>
 *
 * @see com.userhealth.main.Server
 */
package com.userhealth;
