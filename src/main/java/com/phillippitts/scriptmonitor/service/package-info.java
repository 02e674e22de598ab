/**
 * Application services: the alignment engine, the fragment transport, the scoring scheduler
 * and the subtitle relay.
 */
package com.phillippitts.scriptmonitor.service;
